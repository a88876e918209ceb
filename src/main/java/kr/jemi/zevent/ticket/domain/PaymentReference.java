package kr.jemi.zevent.ticket.domain;

import java.util.Objects;

/**
 * 결제사 상관관계 ID 묶음.
 * Stripe: checkoutId = 세션 ID, paymentId = PaymentIntent ID.
 * PayPal: checkoutId = 주문 ID, paymentId = 캡처 ID.
 */
public record PaymentReference(PaymentProviderType provider, String checkoutId, String paymentId) {

    public PaymentReference {
        Objects.requireNonNull(provider, "provider");
    }

    public static PaymentReference checkout(PaymentProviderType provider, String checkoutId) {
        return new PaymentReference(provider, checkoutId, null);
    }

    public boolean hasCheckout() {
        return checkoutId != null && !checkoutId.isBlank();
    }

    public boolean hasPayment() {
        return paymentId != null && !paymentId.isBlank();
    }
}
