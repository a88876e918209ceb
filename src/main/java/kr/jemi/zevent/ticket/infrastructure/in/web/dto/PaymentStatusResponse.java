package kr.jemi.zevent.ticket.infrastructure.in.web.dto;

import kr.jemi.zevent.ticket.domain.TicketStatus;

/**
 * 결제 즉시 확인 응답. status는 paid 또는 pending 둘 중 하나다.
 */
public record PaymentStatusResponse(long ticketId, String status) {

    private static final String PENDING = "pending";

    public static PaymentStatusResponse of(long ticketId, TicketStatus status) {
        // 유예 중이거나 종료된 티켓도 결제 미확정으로 응답한다
        String value = status == TicketStatus.PAID ? TicketStatus.PAID.value() : PENDING;
        return new PaymentStatusResponse(ticketId, value);
    }
}
