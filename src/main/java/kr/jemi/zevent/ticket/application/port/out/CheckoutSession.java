package kr.jemi.zevent.ticket.application.port.out;

import kr.jemi.zevent.ticket.domain.PaymentReference;

public record CheckoutSession(String checkoutUrl, PaymentReference reference) {
}
