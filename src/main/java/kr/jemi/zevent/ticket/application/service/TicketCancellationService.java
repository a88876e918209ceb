package kr.jemi.zevent.ticket.application.service;

import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import kr.jemi.zevent.ticket.application.port.in.AdminCancelTicketUseCase;
import kr.jemi.zevent.ticket.application.port.in.CancelEventTicketsUseCase;
import kr.jemi.zevent.ticket.application.port.in.CancelTicketUseCase;
import kr.jemi.zevent.ticket.application.port.in.RefundTicketUseCase;
import kr.jemi.zevent.ticket.application.port.out.AuditLogPort;
import kr.jemi.zevent.ticket.application.port.out.EventCatalogPort;
import kr.jemi.zevent.ticket.application.port.out.PaymentProviderException;
import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.CancellationMode;
import kr.jemi.zevent.ticket.domain.CancellationResult;
import kr.jemi.zevent.ticket.domain.EventInfo;
import kr.jemi.zevent.ticket.domain.RefundDecision;
import kr.jemi.zevent.ticket.domain.RefundPolicy;
import kr.jemi.zevent.ticket.domain.Ticket;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
public class TicketCancellationService implements CancelTicketUseCase, AdminCancelTicketUseCase,
        RefundTicketUseCase, CancelEventTicketsUseCase {

    private static final Logger log = LoggerFactory.getLogger(TicketCancellationService.class);

    private final TicketPort ticketPort;
    private final EventCatalogPort eventCatalogPort;
    private final AuditLogPort auditLogPort;
    private final PaymentProviderRegistry providerRegistry;
    private final GracePeriodCanceller gracePeriodCanceller;
    private final RefundPolicy refundPolicy;
    private final Clock clock;

    public TicketCancellationService(TicketPort ticketPort,
                                     EventCatalogPort eventCatalogPort,
                                     AuditLogPort auditLogPort,
                                     PaymentProviderRegistry providerRegistry,
                                     GracePeriodCanceller gracePeriodCanceller,
                                     RefundPolicy refundPolicy,
                                     Clock clock) {
        this.ticketPort = ticketPort;
        this.eventCatalogPort = eventCatalogPort;
        this.auditLogPort = auditLogPort;
        this.providerRegistry = providerRegistry;
        this.gracePeriodCanceller = gracePeriodCanceller;
        this.refundPolicy = refundPolicy;
        this.clock = clock;
    }

    @Override
    public CancellationResult cancel(long ticketId, long userId, CancellationMode mode) {
        Ticket ticket = ticketPort.findById(ticketId)
                .filter(t -> t.isOwnedBy(userId))
                .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_NOT_FOUND));
        return cancel(ticket, mode);
    }

    @Override
    public CancellationResult adminCancel(long ticketId, CancellationMode mode, String adminId) {
        Ticket ticket = findTicket(ticketId);
        CancellationResult result = cancel(ticket, mode);
        auditLogPort.record(adminId, "TICKET_CANCEL", ticketId,
                "mode=" + mode + ", outcome=" + result.outcome() + ", refunded=" + result.refundedAmount());
        return result;
    }

    private CancellationResult cancel(Ticket ticket, CancellationMode mode) {
        return switch (ticket.getStatus()) {
            case PENDING -> cancelPending(ticket, mode);
            case PENDING_CANCELLATION -> CancellationResult.gracePeriod(
                    ticket.getId(), gracePeriodCanceller.deadlineFrom(ticket.getCancelledAt()));
            case PAID -> cancelPaid(ticket, mode);
            case CANCELLED, REFUNDED -> throw new BusinessException(ErrorCode.TICKET_NOT_CANCELLABLE);
        };
    }

    private CancellationResult cancelPending(Ticket ticket, CancellationMode mode) {
        long ticketId = ticket.getId();

        // 결제 세션이 없거나 유예 기간을 쓰지 않으면 바로 삭제
        if (!ticket.isCheckoutInFlight() || !gracePeriodCanceller.isEnabled()) {
            if (ticketPort.deletePending(ticketId)) {
                log.info("결제 전 티켓 삭제: ticketId={}", ticketId);
                return CancellationResult.deleted(ticketId);
            }
            return retryWithCurrentState(ticketId, mode);
        }

        // 결제가 진행 중일 수 있으므로 유예 기간을 둔다
        LocalDateTime now = LocalDateTime.now(clock);
        if (ticketPort.requestCancellation(ticketId, now)) {
            LocalDateTime deadline = gracePeriodCanceller.deadlineFrom(now);
            gracePeriodCanceller.schedule(ticketId, deadline);
            return CancellationResult.gracePeriod(ticketId, deadline);
        }
        return retryWithCurrentState(ticketId, mode);
    }

    private CancellationResult cancelPaid(Ticket ticket, CancellationMode mode) {
        if (mode == CancellationMode.NO_REFUND) {
            return cancelWithoutRefund(ticket, mode);
        }

        EventInfo event = eventCatalogPort.findEvent(ticket.getEventId())
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND));
        RefundDecision decision = refundPolicy.evaluate(ticket, LocalDateTime.now(clock), event.startsAt());
        if (!decision.eligible()) {
            if (mode == CancellationMode.REFUND) {
                throw new BusinessException(ErrorCode.REFUND_NOT_ELIGIBLE);
            }
            return cancelWithoutRefund(ticket, mode);
        }

        BigDecimal amount = decision.amount();
        if (amount.signum() == 0) {
            // 환불 비율 0% 또는 무료 티켓
            return cancelWithoutRefund(ticket, mode);
        }

        // 결제사 환불 성공 후에만 상태를 바꾼다
        refundAtProvider(ticket, amount);
        if (!ticketPort.cancelWithRefund(ticket.getId(), amount, LocalDateTime.now(clock))) {
            reportRefundSplit(ticket.getId(), amount);
        } else {
            log.info("티켓 취소 및 부분 환불: ticketId={}, amount={}", ticket.getId(), amount);
        }
        return CancellationResult.cancelled(ticket.getId(), amount);
    }

    private CancellationResult cancelWithoutRefund(Ticket ticket, CancellationMode mode) {
        if (ticketPort.cancel(ticket.getId(), TicketStatus.PAID, LocalDateTime.now(clock))) {
            log.info("티켓 취소(환불 없음): ticketId={}, mode={}", ticket.getId(), mode);
            return CancellationResult.cancelled(ticket.getId(), null);
        }
        return retryWithCurrentState(ticket.getId(), mode);
    }

    // 조건부 갱신에서 졌으면 현재 상태 기준으로 다시 판단한다. 전이는 역방향이 없으므로 유한하다
    private CancellationResult retryWithCurrentState(long ticketId, CancellationMode mode) {
        Ticket current = ticketPort.findById(ticketId)
                .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_NOT_FOUND));
        log.debug("취소 경쟁 발생, 현재 상태로 재시도: ticketId={}, status={}", ticketId, current.getStatus());
        return cancel(current, mode);
    }

    @Override
    public CancellationResult refund(long ticketId, boolean full, String adminId) {
        Ticket ticket = findTicket(ticketId);
        if (ticket.getStatus() != TicketStatus.PAID) {
            throw new BusinessException(ErrorCode.TICKET_NOT_REFUNDABLE);
        }
        BigDecimal amount = full ? ticket.getTotalAmount() : refundPolicy.partialAmount(ticket.getTotalAmount());

        refundAtProvider(ticket, amount);
        if (!ticketPort.markRefunded(ticketId, amount, LocalDateTime.now(clock))) {
            reportRefundSplit(ticketId, amount);
        }
        auditLogPort.record(adminId, "TICKET_REFUND", ticketId, "full=" + full + ", amount=" + amount);
        log.info("관리자 환불: ticketId={}, amount={}, adminId={}", ticketId, amount, adminId);
        return CancellationResult.refunded(ticketId, amount);
    }

    @Override
    public EventCancellationReport cancelEventTickets(long eventId, boolean refund, String adminId) {
        List<Ticket> tickets = ticketPort.findActiveByEventId(eventId);
        int cancelled = 0;
        int refunded = 0;
        List<EventCancellationReport.Failure> failures = new ArrayList<>();

        for (Ticket ticket : tickets) {
            try {
                if (cancelForEvent(ticket, refund)) {
                    refunded++;
                } else {
                    cancelled++;
                }
            } catch (BusinessException e) {
                log.warn("이벤트 일괄 취소 중 티켓 처리 실패: ticketId={}, code={}", ticket.getId(), e.getErrorCode());
                failures.add(new EventCancellationReport.Failure(ticket.getId(), e.getErrorCode().name()));
            }
        }

        auditLogPort.record(adminId, "EVENT_TICKETS_CANCEL", eventId,
                "refund=" + refund + ", cancelled=" + cancelled + ", refunded=" + refunded + ", failed=" + failures.size());
        log.info("이벤트 일괄 취소: eventId={}, cancelled={}, refunded={}, failed={}",
                eventId, cancelled, refunded, failures.size());
        return new EventCancellationReport(eventId, cancelled, refunded, List.copyOf(failures));
    }

    /**
     * @return 환불했으면 true
     */
    private boolean cancelForEvent(Ticket ticket, boolean refund) {
        LocalDateTime now = LocalDateTime.now(clock);
        TicketStatus status = ticket.getStatus();
        if (status == TicketStatus.PAID && refund) {
            refundAtProvider(ticket, ticket.getTotalAmount());
            if (!ticketPort.markRefunded(ticket.getId(), ticket.getTotalAmount(), now)) {
                reportRefundSplit(ticket.getId(), ticket.getTotalAmount());
            }
            return true;
        }
        // PENDING도 삭제하지 않고 이력을 남긴다
        if (!ticketPort.cancel(ticket.getId(), status, now)) {
            throw new BusinessException(ErrorCode.TICKET_NOT_CANCELLABLE);
        }
        if (status == TicketStatus.PENDING_CANCELLATION) {
            gracePeriodCanceller.cancelTimer(ticket.getId());
        }
        return false;
    }

    private void refundAtProvider(Ticket ticket, BigDecimal amount) {
        if (amount.signum() == 0) {
            // 결제사는 0원 환불을 거부한다
            log.info("환불 금액 0, 결제사 호출 생략: ticketId={}", ticket.getId());
            return;
        }
        try {
            providerRegistry.get(ticket.getPaymentProvider()).processRefund(ticket, amount);
        } catch (PaymentProviderException e) {
            log.error("결제사 환불 실패, 티켓 상태 유지: ticketId={}, amount={}", ticket.getId(), amount, e);
            throw new BusinessException(ErrorCode.REFUND_FAILED, e);
        }
    }

    private void reportRefundSplit(long ticketId, BigDecimal amount) {
        Ticket current = ticketPort.findById(ticketId).orElse(null);
        if (current != null && current.getStatus() == TicketStatus.REFUNDED) {
            // 결제사 환불 웹훅이 먼저 반영됨
            log.warn("환불 웹훅이 먼저 반영됨: ticketId={}, amount={}", ticketId, amount);
            return;
        }
        log.error("결제사 환불은 성공했으나 티켓 상태 갱신 실패, 수동 확인 필요: ticketId={}, amount={}, status={}",
                ticketId, amount, current == null ? "deleted" : current.getStatus());
    }

    private Ticket findTicket(long ticketId) {
        return ticketPort.findById(ticketId)
                .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_NOT_FOUND));
    }
}
