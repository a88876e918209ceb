package kr.jemi.zevent.ticket.application.port.out;

import kr.jemi.zevent.ticket.domain.PaymentProviderType;

public class PaymentProviderException extends RuntimeException {

    private final PaymentProviderType provider;

    public PaymentProviderException(PaymentProviderType provider, String message) {
        super(message);
        this.provider = provider;
    }

    public PaymentProviderException(PaymentProviderType provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public PaymentProviderType getProvider() {
        return provider;
    }
}
