package kr.jemi.zevent.ticket.application.port.in;

import kr.jemi.zevent.ticket.domain.CaptureOutcome;

public interface CheckPaymentUseCase {

    /**
     * 결제사에 주문 상태를 조회하고, 승인된 주문이면 캡처까지 진행한다.
     */
    CaptureOutcome checkPayment(long ticketId);
}
