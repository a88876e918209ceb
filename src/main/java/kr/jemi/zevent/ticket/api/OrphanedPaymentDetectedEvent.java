package kr.jemi.zevent.ticket.api;

/**
 * 티켓이 없거나 이미 종료된 상태에서 결제 확정 신호가 도착했다.
 * 고객은 돈을 냈지만 티켓이 없으므로 운영자가 수동으로 처리해야 한다.
 */
public record OrphanedPaymentDetectedEvent(long ticketId,
                                           String paymentProvider,
                                           String checkoutId,
                                           String paymentId,
                                           String ticketStatus) {
}
