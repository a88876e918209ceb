package kr.jemi.zevent.ticket.infrastructure.in.web.dto;

import kr.jemi.zevent.ticket.domain.Ticket;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record TicketResponse(
        long ticketId,
        long eventId,
        String status,
        BigDecimal price,
        boolean includesPickup,
        BigDecimal pickupPrice,
        String pickupAddress,
        BigDecimal totalAmount,
        String paymentProvider,
        BigDecimal refundedAmount,
        LocalDateTime createdAt,
        LocalDateTime completedAt,
        LocalDateTime cancelledAt
) {

    public static TicketResponse from(Ticket ticket) {
        return new TicketResponse(
                ticket.getId(),
                ticket.getEventId(),
                ticket.getStatus().value(),
                ticket.getPrice(),
                ticket.isIncludesPickup(),
                ticket.getPickupPrice(),
                ticket.getPickupAddress(),
                ticket.getTotalAmount(),
                ticket.getPaymentProvider() == null ? null : ticket.getPaymentProvider().value(),
                ticket.getRefundedAmount(),
                ticket.getCreatedAt(),
                ticket.getCompletedAt(),
                ticket.getCancelledAt()
        );
    }
}
