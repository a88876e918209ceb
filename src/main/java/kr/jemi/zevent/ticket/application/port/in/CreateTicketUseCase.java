package kr.jemi.zevent.ticket.application.port.in;

import kr.jemi.zevent.ticket.domain.PaymentProviderType;

public interface CreateTicketUseCase {

    CheckoutResult create(CreateTicketCommand command);

    record CreateTicketCommand(long userId,
                               long eventId,
                               boolean includesPickup,
                               String pickupAddress,
                               PaymentProviderType provider) {
    }
}
