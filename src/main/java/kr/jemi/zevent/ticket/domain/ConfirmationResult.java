package kr.jemi.zevent.ticket.domain;

public enum ConfirmationResult {

    CONFIRMED,
    /** 유예 기간 중 결제 도착 */
    REACTIVATED,
    ALREADY_PAID,
    /** 티켓이 없거나 종료 상태인데 돈이 들어옴 */
    ORPHANED;

    public boolean isPaid() {
        return this != ORPHANED;
    }
}
