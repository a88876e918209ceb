package kr.jemi.zevent.ticket.infrastructure.in.web.dto;

import kr.jemi.zevent.ticket.application.port.in.CheckoutResult;

public record CheckoutResponse(long ticketId, String checkoutUrl, String paymentProvider) {

    public static CheckoutResponse from(CheckoutResult result) {
        return new CheckoutResponse(
                result.ticket().getId(),
                result.checkoutUrl(),
                result.provider().value()
        );
    }
}
