package kr.jemi.zevent.ticket.application.port.out;

import kr.jemi.zevent.ticket.domain.Buyer;
import kr.jemi.zevent.ticket.domain.EventInfo;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.Ticket;

import java.math.BigDecimal;

/**
 * 결제사별 차이는 이 인터페이스의 구현체 안에만 존재한다.
 */
public interface PaymentProviderPort {

    PaymentProviderType providerName();

    /**
     * 원격 결제 세션(주문)을 만들고 리다이렉트 URL과 상관관계 ID를 돌려준다.
     *
     * @throws PaymentProviderException 결제사 호출 실패
     */
    CheckoutSession createCheckout(Ticket ticket, EventInfo event, Buyer buyer, BigDecimal totalAmount);

    /**
     * 캡처(PaymentIntent) ID 기준 부분/전액 환불.
     *
     * @throws PaymentProviderException 캡처 ID가 없거나 결제사 호출 실패
     */
    void processRefund(Ticket ticket, BigDecimal amount);

    /**
     * 원격 상태를 조회하고, 승인됐지만 캡처되지 않은 주문은 캡처한다. 여러 번 호출해도 안전하다.
     *
     * @throws PaymentProviderException 결제사 호출 실패
     */
    PaymentCheck checkAndCaptureOrder(Ticket ticket);
}
