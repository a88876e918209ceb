package kr.jemi.zevent.ticket.application.port.in;

import kr.jemi.zevent.ticket.domain.PaymentProviderType;

import java.math.BigDecimal;

/**
 * 결제 확정 외에 결제사가 먼저 알려주는 상태 변화.
 */
public interface HandleProviderEventUseCase {

    /**
     * 티켓에 현재 연결된 세션/주문이 만료된 경우에만 취소한다.
     */
    void expireCheckout(long ticketId, PaymentProviderType provider, String checkoutId);

    void recordProviderRefund(PaymentProviderType provider, String paymentId, BigDecimal amount);
}
