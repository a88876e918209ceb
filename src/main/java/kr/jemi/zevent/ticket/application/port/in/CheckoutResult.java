package kr.jemi.zevent.ticket.application.port.in;

import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.Ticket;

public record CheckoutResult(Ticket ticket, String checkoutUrl, PaymentProviderType provider) {
}
