package kr.jemi.zevent.ticket.application.port.in;

import kr.jemi.zevent.ticket.domain.ConfirmationResult;
import kr.jemi.zevent.ticket.domain.PaymentReference;

/**
 * 웹훅, 폴러, 사용자 복귀 중 어느 경로로 들어와도 같은 결과를 내는 결제 확정.
 */
public interface ConfirmPaymentUseCase {

    ConfirmationResult confirmPayment(long ticketId, PaymentReference reference);
}
