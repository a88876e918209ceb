package kr.jemi.zevent.ticket.application.service;

import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import kr.jemi.zevent.ticket.application.port.in.CheckPaymentUseCase;
import kr.jemi.zevent.ticket.application.port.in.ProactiveConfirmUseCase;
import kr.jemi.zevent.ticket.application.port.out.PaymentCheck;
import kr.jemi.zevent.ticket.application.port.out.PaymentProviderException;
import kr.jemi.zevent.ticket.application.port.out.PaymentProviderPort;
import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.CaptureOutcome;
import kr.jemi.zevent.ticket.domain.ConfirmationResult;
import kr.jemi.zevent.ticket.domain.Ticket;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 결제사 조회(필요 시 캡처) 결과를 결제 확정으로 연결한다.
 * 폴러, 정체 티켓 정리, 사용자 복귀, PayPal 승인 웹훅이 모두 이 경로를 쓴다.
 */
@Service
public class PaymentCheckService implements CheckPaymentUseCase, ProactiveConfirmUseCase {

    private static final Logger log = LoggerFactory.getLogger(PaymentCheckService.class);

    private final TicketPort ticketPort;
    private final PaymentProviderRegistry providerRegistry;
    private final PaymentConfirmationService paymentConfirmationService;

    public PaymentCheckService(TicketPort ticketPort,
                               PaymentProviderRegistry providerRegistry,
                               PaymentConfirmationService paymentConfirmationService) {
        this.ticketPort = ticketPort;
        this.providerRegistry = providerRegistry;
        this.paymentConfirmationService = paymentConfirmationService;
    }

    @Override
    public CaptureOutcome checkPayment(long ticketId) {
        Ticket ticket = ticketPort.findById(ticketId)
                .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_NOT_FOUND));
        return check(ticket);
    }

    @Override
    public TicketStatus confirmNow(long ticketId, long userId) {
        Ticket ticket = ticketPort.findById(ticketId)
                .filter(t -> t.isOwnedBy(userId))
                .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_NOT_FOUND));
        if (ticket.getStatus() != TicketStatus.PENDING
                && ticket.getStatus() != TicketStatus.PENDING_CANCELLATION) {
            return ticket.getStatus();
        }
        check(ticket);
        return ticketPort.findById(ticketId)
                .map(Ticket::getStatus)
                .orElse(ticket.getStatus());
    }

    /**
     * 결제사 오류는 PENDING으로 보고한다. 성공으로 간주하지 않는다.
     */
    CaptureOutcome check(Ticket ticket) {
        PaymentProviderPort provider = providerRegistry.get(ticket.getPaymentProvider());
        if (!ticket.isCheckoutInFlight()) {
            return CaptureOutcome.PENDING;
        }

        PaymentCheck result;
        try {
            result = provider.checkAndCaptureOrder(ticket);
        } catch (PaymentProviderException e) {
            log.warn("결제 상태 조회 실패: ticketId={}, provider={}, cause={}",
                    ticket.getId(), provider.providerName(), e.getMessage());
            return CaptureOutcome.PENDING;
        }

        if (result.outcome().isPaid()) {
            ConfirmationResult confirmation = paymentConfirmationService.confirmPayment(ticket.getId(), result.reference());
            if (confirmation.isPaid()) {
                log.info("결제 조회로 확정: ticketId={}, result={}", ticket.getId(), confirmation);
            } else {
                log.warn("결제 조회 결과 종료된 티켓에 결제 존재: ticketId={}", ticket.getId());
            }
        }
        return result.outcome();
    }
}
