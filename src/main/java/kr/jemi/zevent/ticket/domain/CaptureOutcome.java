package kr.jemi.zevent.ticket.domain;

public enum CaptureOutcome {

    CAPTURED,
    PENDING,
    /** 원격 주문이 결제 없이 종료됨 (만료, 취소) */
    ABANDONED;

    public boolean isPaid() {
        return this == CAPTURED;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
