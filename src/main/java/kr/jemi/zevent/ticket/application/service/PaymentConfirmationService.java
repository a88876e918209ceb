package kr.jemi.zevent.ticket.application.service;

import kr.jemi.zevent.ticket.api.OrphanedPaymentDetectedEvent;
import kr.jemi.zevent.ticket.api.TicketPaidEvent;
import kr.jemi.zevent.ticket.application.port.in.ConfirmPaymentUseCase;
import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.ConfirmationResult;
import kr.jemi.zevent.ticket.domain.PaymentReference;
import kr.jemi.zevent.ticket.domain.Ticket;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

@Service
public class PaymentConfirmationService implements ConfirmPaymentUseCase {

    private static final Logger log = LoggerFactory.getLogger(PaymentConfirmationService.class);

    private final TicketPort ticketPort;
    private final GracePeriodCanceller gracePeriodCanceller;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public PaymentConfirmationService(TicketPort ticketPort,
                                      GracePeriodCanceller gracePeriodCanceller,
                                      ApplicationEventPublisher eventPublisher,
                                      Clock clock) {
        this.ticketPort = ticketPort;
        this.gracePeriodCanceller = gracePeriodCanceller;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    @Override
    @Transactional
    public ConfirmationResult confirmPayment(long ticketId, PaymentReference reference) {
        LocalDateTime now = LocalDateTime.now(clock);

        // 1. PENDING → PAID
        if (ticketPort.markPaid(ticketId, TicketStatus.PENDING, reference, now)) {
            Ticket ticket = reload(ticketId);
            publishPaid(ticket, false);
            log.info("결제 확정: ticketId={}, provider={}, paymentId={}",
                    ticketId, reference.provider(), reference.paymentId());
            return ConfirmationResult.CONFIRMED;
        }

        // 2. PENDING_CANCELLATION → PAID (유예 기간 중 결제 도착)
        if (ticketPort.markPaid(ticketId, TicketStatus.PENDING_CANCELLATION, reference, now)) {
            gracePeriodCanceller.cancelTimer(ticketId);
            Ticket ticket = reload(ticketId);
            publishPaid(ticket, true);
            log.warn("취소 유예 중 결제 도착, 티켓 복구: ticketId={}, provider={}, paymentId={}",
                    ticketId, reference.provider(), reference.paymentId());
            return ConfirmationResult.REACTIVATED;
        }

        // 3. 이미 PAID면 중복 신호
        Optional<Ticket> current = ticketPort.findById(ticketId);
        if (current.isPresent()
                && current.get().getStatus() == TicketStatus.PAID
                && current.get().isPaidWith(reference.provider())) {
            log.debug("이미 결제 확정된 티켓: ticketId={}", ticketId);
            return ConfirmationResult.ALREADY_PAID;
        }

        // 4. 티켓이 없거나 종료 상태인데 돈이 들어옴
        String status = current.map(t -> t.getStatus().value()).orElse("deleted");
        log.error("미아 결제 감지, 운영자 확인 필요: ticketId={}, status={}, provider={}, checkoutId={}, paymentId={}",
                ticketId, status, reference.provider(), reference.checkoutId(), reference.paymentId());
        eventPublisher.publishEvent(new OrphanedPaymentDetectedEvent(
                ticketId,
                reference.provider().value(),
                reference.checkoutId(),
                reference.paymentId(),
                status));
        return ConfirmationResult.ORPHANED;
    }

    private Ticket reload(long ticketId) {
        return ticketPort.findById(ticketId)
                .orElseThrow(() -> new IllegalStateException("결제 확정 직후 티켓 없음: " + ticketId));
    }

    private void publishPaid(Ticket ticket, boolean reactivated) {
        eventPublisher.publishEvent(new TicketPaidEvent(
                ticket.getId(),
                ticket.getUserId(),
                ticket.getEventId(),
                ticket.getTotalAmount(),
                ticket.getPaymentProvider().value(),
                reactivated));
    }
}
