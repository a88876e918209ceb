package kr.jemi.zevent.notification.domain;

/**
 * 운영자가 직접 확인해야 하는 결제 이상.
 */
public record OperatorAlert(Severity severity, String title, String detail) {

    public enum Severity {
        WARNING,
        CRITICAL
    }

    public static OperatorAlert orphanedPayment(long ticketId, String provider, String checkoutId,
                                                String paymentId, String ticketStatus) {
        return new OperatorAlert(
                Severity.CRITICAL,
                "결제 완료 티켓 없음 (ticketId=" + ticketId + ")",
                "provider=" + provider
                        + ", checkoutId=" + checkoutId
                        + ", paymentId=" + paymentId
                        + ", ticketStatus=" + ticketStatus
                        + ". 결제사 콘솔에서 환불 또는 티켓 재발급이 필요합니다."
        );
    }

    public static OperatorAlert reactivatedTicket(long ticketId, String provider) {
        return new OperatorAlert(
                Severity.WARNING,
                "취소 유예 중 결제 확정 (ticketId=" + ticketId + ")",
                "provider=" + provider + ". 취소 요청이 철회되고 티켓이 paid로 복구되었습니다."
        );
    }
}
