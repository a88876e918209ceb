package kr.jemi.zevent.ticket.infrastructure.out.payment.stripe;

import com.stripe.StripeClient;
import com.stripe.exception.StripeException;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.param.RefundCreateParams;
import com.stripe.param.checkout.SessionCreateParams;
import kr.jemi.zevent.ticket.application.port.out.CheckoutSession;
import kr.jemi.zevent.ticket.application.port.out.PaymentCheck;
import kr.jemi.zevent.ticket.application.port.out.PaymentProviderException;
import kr.jemi.zevent.ticket.application.port.out.PaymentProviderPort;
import kr.jemi.zevent.ticket.domain.Buyer;
import kr.jemi.zevent.ticket.domain.EventInfo;
import kr.jemi.zevent.ticket.domain.Money;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.PaymentReference;
import kr.jemi.zevent.ticket.domain.Ticket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;

/**
 * Stripe Checkout은 자동 캡처다. 세션의 payment_status가 paid면 결제 완료로 본다.
 */
@Component
public class StripePaymentAdapter implements PaymentProviderPort {

    private static final Logger log = LoggerFactory.getLogger(StripePaymentAdapter.class);

    static final String TICKET_ID_METADATA = "ticket_id";

    // Stripe는 생성 시점 기준 30분 미만의 expires_at을 거부한다
    static final Duration MIN_SESSION_LIFETIME = Duration.ofMinutes(31);

    private final StripeClient stripeClient;
    private final StripeProperties properties;
    private final Clock clock;
    private final Duration sessionLifetime;

    public StripePaymentAdapter(StripeClient stripeClient,
                                StripeProperties properties,
                                Clock clock,
                                @Value("${zevent.ticket.pending-ttl}") Duration pendingTtl) {
        this.stripeClient = stripeClient;
        this.properties = properties;
        this.clock = clock;
        this.sessionLifetime = pendingTtl.compareTo(MIN_SESSION_LIFETIME) < 0 ? MIN_SESSION_LIFETIME : pendingTtl;
    }

    @Override
    public PaymentProviderType providerName() {
        return PaymentProviderType.STRIPE;
    }

    @Override
    public CheckoutSession createCheckout(Ticket ticket, EventInfo event, Buyer buyer, BigDecimal totalAmount) {
        String ticketId = String.valueOf(ticket.getId());
        SessionCreateParams.Builder params = SessionCreateParams.builder()
                .setMode(SessionCreateParams.Mode.PAYMENT)
                .setSuccessUrl(properties.successUrl() + "?ticket_id=" + ticketId + "&session_id={CHECKOUT_SESSION_ID}")
                .setCancelUrl(properties.cancelUrl() + "?ticket_id=" + ticketId)
                .setClientReferenceId(ticketId)
                .setCustomerEmail(buyer.email())
                .setExpiresAt(clock.instant().plus(sessionLifetime).getEpochSecond())
                .putMetadata(TICKET_ID_METADATA, ticketId)
                .setPaymentIntentData(SessionCreateParams.PaymentIntentData.builder()
                        .putMetadata(TICKET_ID_METADATA, ticketId)
                        .build())
                .addLineItem(lineItem("Ticket: " + event.name(), ticket.getPrice()));

        BigDecimal itemsTotal = ticket.getPrice();
        if (ticket.isIncludesPickup()) {
            params.addLineItem(lineItem("Pickup service", ticket.getPickupPrice()));
            itemsTotal = itemsTotal.add(ticket.getPickupPrice());
        }
        if (itemsTotal.compareTo(totalAmount) != 0) {
            throw new PaymentProviderException(providerName(),
                    "결제 항목 합계가 총액과 다릅니다: items=" + itemsTotal + ", total=" + totalAmount);
        }

        try {
            Session session = stripeClient.checkout().sessions().create(params.build());
            log.info("Stripe 결제 세션 생성: ticketId={}, sessionId={}", ticketId, session.getId());
            return new CheckoutSession(session.getUrl(),
                    PaymentReference.checkout(providerName(), session.getId()));
        } catch (StripeException e) {
            throw new PaymentProviderException(providerName(), "Stripe 세션 생성 실패: " + e.getMessage(), e);
        }
    }

    private SessionCreateParams.LineItem lineItem(String name, BigDecimal amount) {
        return SessionCreateParams.LineItem.builder()
                .setQuantity(1L)
                .setPriceData(SessionCreateParams.LineItem.PriceData.builder()
                        .setCurrency(Money.CURRENCY.toLowerCase())
                        .setUnitAmount(Money.toMinorUnits(amount))
                        .setProductData(SessionCreateParams.LineItem.PriceData.ProductData.builder()
                                .setName(name)
                                .build())
                        .build())
                .build();
    }

    @Override
    public void processRefund(Ticket ticket, BigDecimal amount) {
        String paymentIntentId = ticket.getStripePaymentIntentId();
        if (paymentIntentId == null || paymentIntentId.isBlank()) {
            throw new PaymentProviderException(providerName(),
                    "환불할 PaymentIntent ID가 없습니다: ticketId=" + ticket.getId());
        }
        long minorAmount = Money.toMinorUnits(amount);
        RefundCreateParams params = RefundCreateParams.builder()
                .setPaymentIntent(paymentIntentId)
                .setAmount(minorAmount)
                .putMetadata(TICKET_ID_METADATA, String.valueOf(ticket.getId()))
                .build();
        // 같은 티켓, 같은 금액의 재시도는 Stripe가 한 번만 처리한다
        RequestOptions options = RequestOptions.builder()
                .setIdempotencyKey("refund-" + ticket.getId() + "-" + minorAmount)
                .build();
        try {
            stripeClient.refunds().create(params, options);
            log.info("Stripe 환불 완료: ticketId={}, paymentIntentId={}, amount={}",
                    ticket.getId(), paymentIntentId, amount);
        } catch (StripeException e) {
            throw new PaymentProviderException(providerName(), "Stripe 환불 실패: " + e.getMessage(), e);
        }
    }

    @Override
    public PaymentCheck checkAndCaptureOrder(Ticket ticket) {
        String sessionId = ticket.getStripeSessionId();
        if (sessionId == null || sessionId.isBlank()) {
            return PaymentCheck.pending();
        }
        Session session;
        try {
            session = stripeClient.checkout().sessions().retrieve(sessionId);
        } catch (StripeException e) {
            throw new PaymentProviderException(providerName(), "Stripe 세션 조회 실패: " + e.getMessage(), e);
        }

        if ("paid".equals(session.getPaymentStatus())) {
            return PaymentCheck.captured(new PaymentReference(providerName(), session.getId(), session.getPaymentIntent()));
        }
        if ("expired".equals(session.getStatus())) {
            return PaymentCheck.abandoned();
        }
        return PaymentCheck.pending();
    }
}
