package kr.jemi.zevent.ticket.application.port.in;

public interface RetryCheckoutUseCase {

    CheckoutResult retryCheckout(long ticketId, long userId);
}
