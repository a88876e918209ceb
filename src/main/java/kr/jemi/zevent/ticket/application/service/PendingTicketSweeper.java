package kr.jemi.zevent.ticket.application.service;

import kr.jemi.zevent.ticket.application.port.in.SweepStalePendingUseCase;
import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.CaptureOutcome;
import kr.jemi.zevent.ticket.domain.Ticket;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 오래 방치된 PENDING 티켓을 결제사에 마지막으로 확인한 뒤 정리한다.
 * 결제 여부가 불확실하면 바로 지우지 않고 유예 기간에 넣는다.
 */
@Service
public class PendingTicketSweeper implements SweepStalePendingUseCase {

    private static final Logger log = LoggerFactory.getLogger(PendingTicketSweeper.class);

    private final TicketPort ticketPort;
    private final PaymentCheckService paymentCheckService;
    private final GracePeriodCanceller gracePeriodCanceller;
    private final Clock clock;
    private final Duration pendingTtl;

    public PendingTicketSweeper(TicketPort ticketPort,
                                PaymentCheckService paymentCheckService,
                                GracePeriodCanceller gracePeriodCanceller,
                                Clock clock,
                                @Value("${zevent.ticket.pending-ttl}") Duration pendingTtl) {
        this.ticketPort = ticketPort;
        this.paymentCheckService = paymentCheckService;
        this.gracePeriodCanceller = gracePeriodCanceller;
        this.clock = clock;
        this.pendingTtl = pendingTtl;
    }

    @Override
    public int sweepStalePending() {
        LocalDateTime threshold = LocalDateTime.now(clock).minus(pendingTtl);
        List<Ticket> stale = ticketPort.findPendingCreatedBefore(threshold);
        int swept = 0;
        for (Ticket ticket : stale) {
            if (sweep(ticket)) {
                swept++;
            }
        }
        if (!stale.isEmpty()) {
            log.info("정체 PENDING 티켓 정리: 대상 {}건, 처리 {}건", stale.size(), swept);
        }
        return swept;
    }

    private boolean sweep(Ticket ticket) {
        long ticketId = ticket.getId();
        CaptureOutcome outcome = paymentCheckService.check(ticket);
        if (outcome.isPaid()) {
            return false;
        }

        LocalDateTime now = LocalDateTime.now(clock);
        boolean mayStillPay = outcome == CaptureOutcome.PENDING && ticket.isCheckoutInFlight();
        if (mayStillPay && gracePeriodCanceller.isEnabled()) {
            if (ticketPort.requestCancellation(ticketId, now)) {
                gracePeriodCanceller.schedule(ticketId, gracePeriodCanceller.deadlineFrom(now));
                return true;
            }
            return false;
        }
        boolean cancelled = ticketPort.cancel(ticketId, TicketStatus.PENDING, now);
        if (cancelled) {
            log.info("정체 PENDING 티켓 취소: ticketId={}, outcome={}", ticketId, outcome);
        }
        return cancelled;
    }
}
