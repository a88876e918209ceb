package kr.jemi.zevent.ticket.application.service;

import io.hypersistence.tsid.TSID;
import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import kr.jemi.zevent.ticket.application.port.in.CheckoutResult;
import kr.jemi.zevent.ticket.application.port.in.CreateTicketUseCase;
import kr.jemi.zevent.ticket.application.port.in.GetTicketsUseCase;
import kr.jemi.zevent.ticket.application.port.in.RetryCheckoutUseCase;
import kr.jemi.zevent.ticket.application.port.out.BuyerPort;
import kr.jemi.zevent.ticket.application.port.out.CheckoutSession;
import kr.jemi.zevent.ticket.application.port.out.EventCatalogPort;
import kr.jemi.zevent.ticket.application.port.out.PaymentProviderException;
import kr.jemi.zevent.ticket.application.port.out.PaymentProviderPort;
import kr.jemi.zevent.ticket.application.port.out.PurchaseLockPort;
import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.Buyer;
import kr.jemi.zevent.ticket.domain.EventInfo;
import kr.jemi.zevent.ticket.domain.PriceBreakdown;
import kr.jemi.zevent.ticket.domain.PricingPolicy;
import kr.jemi.zevent.ticket.domain.Ticket;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Service
public class TicketService implements CreateTicketUseCase, RetryCheckoutUseCase, GetTicketsUseCase {

    private static final Logger log = LoggerFactory.getLogger(TicketService.class);

    private final TicketPort ticketPort;
    private final EventCatalogPort eventCatalogPort;
    private final BuyerPort buyerPort;
    private final PurchaseLockPort purchaseLockPort;
    private final PaymentProviderRegistry providerRegistry;
    private final ReconciliationPoller reconciliationPoller;
    private final PricingPolicy pricingPolicy;
    private final TSID.Factory tsidFactory;
    private final Clock clock;
    private final long purchaseLockTtlSeconds;

    public TicketService(TicketPort ticketPort,
                         EventCatalogPort eventCatalogPort,
                         BuyerPort buyerPort,
                         PurchaseLockPort purchaseLockPort,
                         PaymentProviderRegistry providerRegistry,
                         ReconciliationPoller reconciliationPoller,
                         PricingPolicy pricingPolicy,
                         TSID.Factory tsidFactory,
                         Clock clock,
                         @Value("${zevent.ticket.purchase-lock-ttl-seconds}") long purchaseLockTtlSeconds) {
        this.ticketPort = ticketPort;
        this.eventCatalogPort = eventCatalogPort;
        this.buyerPort = buyerPort;
        this.purchaseLockPort = purchaseLockPort;
        this.providerRegistry = providerRegistry;
        this.reconciliationPoller = reconciliationPoller;
        this.pricingPolicy = pricingPolicy;
        this.tsidFactory = tsidFactory;
        this.clock = clock;
        this.purchaseLockTtlSeconds = purchaseLockTtlSeconds;
    }

    @Override
    public CheckoutResult create(CreateTicketCommand command) {
        // 1. 구매자, 이벤트, 그룹, 픽업 검증 (부작용 없음)
        Buyer buyer = buyerPort.findBuyer(command.userId())
                .orElseThrow(() -> new BusinessException(ErrorCode.BUYER_NOT_FOUND));
        EventInfo event = eventCatalogPort.findEvent(command.eventId())
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND));
        if (!pricingPolicy.isAllowed(event, buyer.group())) {
            throw new BusinessException(ErrorCode.GROUP_NOT_ALLOWED);
        }
        if (command.includesPickup()
                && (command.pickupAddress() == null || command.pickupAddress().isBlank())) {
            throw new BusinessException(ErrorCode.PICKUP_ADDRESS_REQUIRED);
        }
        PaymentProviderPort provider = providerRegistry.resolve(command.provider());

        // 2. (사용자, 이벤트) 구매 락 안에서 중복/정원 확인 후 PENDING 저장
        Ticket ticket = insertPending(command, event, buyer, provider);

        // 3. 결제 세션 생성, 실패 시 방금 만든 티켓 삭제
        CheckoutSession session;
        try {
            session = provider.createCheckout(ticket, event, buyer, ticket.getTotalAmount());
        } catch (PaymentProviderException e) {
            log.error("결제 세션 생성 실패, 티켓 삭제: ticketId={}, provider={}",
                    ticket.getId(), provider.providerName(), e);
            ticketPort.deletePending(ticket.getId());
            throw new BusinessException(ErrorCode.PAYMENT_PROVIDER_ERROR, e);
        }

        // 4. 상관관계 ID 저장 후 폴러 시작
        Ticket attached = attachCheckout(ticket.getId(), session);
        reconciliationPoller.start(attached);
        log.info("티켓 생성: ticketId={}, userId={}, eventId={}, total={}, provider={}",
                attached.getId(), attached.getUserId(), attached.getEventId(),
                attached.getTotalAmount(), provider.providerName());
        return new CheckoutResult(attached, session.checkoutUrl(), provider.providerName());
    }

    private Ticket insertPending(CreateTicketCommand command, EventInfo event, Buyer buyer,
                                 PaymentProviderPort provider) {
        long id = tsidFactory.generate().toLong();
        String lockOwner = Long.toString(id);
        if (!purchaseLockPort.tryLock(command.userId(), command.eventId(), lockOwner, purchaseLockTtlSeconds)) {
            throw new BusinessException(ErrorCode.PURCHASE_IN_PROGRESS);
        }
        try {
            if (ticketPort.existsActive(command.userId(), command.eventId())) {
                throw new BusinessException(ErrorCode.DUPLICATE_TICKET);
            }
            if (ticketPort.countActiveForEvent(command.eventId()) >= event.capacity()) {
                throw new BusinessException(ErrorCode.EVENT_SOLD_OUT);
            }
            PriceBreakdown breakdown = pricingPolicy.price(event, buyer.group(), command.includesPickup());
            Ticket ticket = Ticket.create(id, command.userId(), command.eventId(), breakdown,
                    command.pickupAddress(), provider.providerName(), LocalDateTime.now(clock));
            return ticketPort.insert(ticket);
        } finally {
            purchaseLockPort.unlock(command.userId(), command.eventId(), lockOwner);
        }
    }

    @Override
    public CheckoutResult retryCheckout(long ticketId, long userId) {
        Ticket ticket = findOwned(ticketId, userId);
        if (ticket.getStatus() != TicketStatus.PENDING) {
            throw new BusinessException(ErrorCode.TICKET_NOT_PENDING);
        }
        PaymentProviderPort provider = providerRegistry.get(ticket.getPaymentProvider());
        EventInfo event = eventCatalogPort.findEvent(ticket.getEventId())
                .orElseThrow(() -> new BusinessException(ErrorCode.EVENT_NOT_FOUND));
        Buyer buyer = buyerPort.findBuyer(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.BUYER_NOT_FOUND));

        CheckoutSession session;
        try {
            session = provider.createCheckout(ticket, event, buyer, ticket.getTotalAmount());
        } catch (PaymentProviderException e) {
            log.error("결제 세션 재생성 실패: ticketId={}, provider={}", ticketId, provider.providerName(), e);
            throw new BusinessException(ErrorCode.PAYMENT_PROVIDER_ERROR, e);
        }

        Ticket attached = attachCheckout(ticketId, session);
        reconciliationPoller.start(attached);
        log.info("결제 세션 재발급: ticketId={}, provider={}", ticketId, provider.providerName());
        return new CheckoutResult(attached, session.checkoutUrl(), provider.providerName());
    }

    private Ticket attachCheckout(long ticketId, CheckoutSession session) {
        if (!ticketPort.attachCheckout(ticketId, session.reference(), LocalDateTime.now(clock))) {
            // 세션 생성 중 사용자가 취소함. 결제가 들어오면 미아 결제 경로로 처리된다
            log.warn("결제 세션 연결 실패, 티켓이 더 이상 PENDING이 아님: ticketId={}, checkoutId={}",
                    ticketId, session.reference().checkoutId());
            throw new BusinessException(ErrorCode.TICKET_NOT_PENDING);
        }
        return ticketPort.findById(ticketId)
                .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_NOT_FOUND));
    }

    @Override
    public List<Ticket> getMyTickets(long userId) {
        return ticketPort.findByUserId(userId);
    }

    @Override
    public Ticket getMyTicket(long ticketId, long userId) {
        return findOwned(ticketId, userId);
    }

    private Ticket findOwned(long ticketId, long userId) {
        // 소유자가 아니면 존재 여부도 노출하지 않는다
        return ticketPort.findById(ticketId)
                .filter(t -> t.isOwnedBy(userId))
                .orElseThrow(() -> new BusinessException(ErrorCode.TICKET_NOT_FOUND));
    }
}
