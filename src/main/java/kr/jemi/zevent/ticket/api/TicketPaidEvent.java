package kr.jemi.zevent.ticket.api;

import java.math.BigDecimal;

public record TicketPaidEvent(long ticketId,
                              long userId,
                              long eventId,
                              BigDecimal totalAmount,
                              String paymentProvider,
                              boolean reactivated) {
}
