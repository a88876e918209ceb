package kr.jemi.zevent.ticket.application.service;

import kr.jemi.zevent.ticket.application.port.in.HandleProviderEventUseCase;
import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.Money;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.PaymentReference;
import kr.jemi.zevent.ticket.domain.Ticket;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.Optional;

@Service
public class ProviderEventService implements HandleProviderEventUseCase {

    private static final Logger log = LoggerFactory.getLogger(ProviderEventService.class);

    private final TicketPort ticketPort;
    private final ReconciliationPoller reconciliationPoller;
    private final GracePeriodCanceller gracePeriodCanceller;
    private final Clock clock;

    public ProviderEventService(TicketPort ticketPort,
                                ReconciliationPoller reconciliationPoller,
                                GracePeriodCanceller gracePeriodCanceller,
                                Clock clock) {
        this.ticketPort = ticketPort;
        this.reconciliationPoller = reconciliationPoller;
        this.gracePeriodCanceller = gracePeriodCanceller;
        this.clock = clock;
    }

    /**
     * 결제 세션이 만료되면 더 이상 결제가 들어올 수 없으므로 바로 취소한다.
     */
    @Override
    public void expireCheckout(long ticketId, PaymentProviderType provider, String checkoutId) {
        Optional<Ticket> found = ticketPort.findById(ticketId);
        if (found.isEmpty() || found.get().getPaymentProvider() != provider) {
            log.debug("만료 이벤트 무시, 대상 티켓 없음: ticketId={}, provider={}", ticketId, provider);
            return;
        }
        Ticket ticket = found.get();
        String currentCheckoutId = ticket.paymentReference()
                .map(PaymentReference::checkoutId)
                .orElse(null);
        if (!Objects.equals(currentCheckoutId, checkoutId)) {
            // 재시도로 교체된 이전 세션의 만료
            log.info("교체된 결제 세션 만료 무시: ticketId={}, expired={}, current={}",
                    ticketId, checkoutId, currentCheckoutId);
            return;
        }
        TicketStatus status = ticket.getStatus();
        if (status != TicketStatus.PENDING && status != TicketStatus.PENDING_CANCELLATION) {
            return;
        }
        if (ticketPort.cancel(ticketId, status, LocalDateTime.now(clock))) {
            reconciliationPoller.stop(ticketId);
            gracePeriodCanceller.cancelTimer(ticketId);
            log.info("결제 세션 만료로 티켓 취소: ticketId={}, from={}", ticketId, status);
        }
    }

    @Override
    public void recordProviderRefund(PaymentProviderType provider, String paymentId, BigDecimal amount) {
        Optional<Ticket> found = ticketPort.findByPaymentId(new PaymentReference(provider, null, paymentId));
        if (found.isEmpty()) {
            log.warn("결제사 환불 이벤트의 티켓을 찾을 수 없음: provider={}, paymentId={}", provider, paymentId);
            return;
        }
        Ticket ticket = found.get();
        if (ticket.getStatus() != TicketStatus.PAID) {
            // 우리가 요청한 환불의 후속 알림
            log.debug("결제사 환불 이벤트 무시: ticketId={}, status={}", ticket.getId(), ticket.getStatus());
            return;
        }
        BigDecimal refunded = Money.of(amount).min(ticket.getTotalAmount());
        if (ticketPort.markRefunded(ticket.getId(), refunded, LocalDateTime.now(clock))) {
            log.info("결제사 측 환불 반영: ticketId={}, amount={}, provider={}", ticket.getId(), refunded, provider);
        }
    }
}
