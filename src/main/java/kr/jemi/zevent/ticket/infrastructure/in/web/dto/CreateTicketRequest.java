package kr.jemi.zevent.ticket.infrastructure.in.web.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import kr.jemi.zevent.ticket.application.port.in.CreateTicketUseCase.CreateTicketCommand;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;

public record CreateTicketRequest(
        @NotNull @Positive Long eventId,
        boolean includesPickup,
        @Size(max = 500) String pickupAddress,
        String paymentProvider
) {

    public CreateTicketCommand toCommand(long userId) {
        return new CreateTicketCommand(userId, eventId, includesPickup, pickupAddress, provider());
    }

    private PaymentProviderType provider() {
        if (paymentProvider == null || paymentProvider.isBlank()) {
            return null;
        }
        try {
            return PaymentProviderType.from(paymentProvider.trim());
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.PAYMENT_PROVIDER_UNAVAILABLE, e);
        }
    }
}
