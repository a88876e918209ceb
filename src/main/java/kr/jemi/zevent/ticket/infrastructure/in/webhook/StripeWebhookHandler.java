package kr.jemi.zevent.ticket.infrastructure.in.webhook;

import com.stripe.exception.EventDataObjectDeserializationException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.model.Charge;
import com.stripe.model.Event;
import com.stripe.model.EventDataObjectDeserializer;
import com.stripe.model.StripeObject;
import com.stripe.model.checkout.Session;
import com.stripe.net.Webhook;
import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import kr.jemi.zevent.ticket.application.port.in.ConfirmPaymentUseCase;
import kr.jemi.zevent.ticket.application.port.in.HandleProviderEventUseCase;
import kr.jemi.zevent.ticket.domain.ConfirmationResult;
import kr.jemi.zevent.ticket.domain.Money;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.PaymentReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * 서명 검증이 끝나기 전에는 어떤 필드도 읽지 않는다.
 */
@Component
public class StripeWebhookHandler {

    private static final Logger log = LoggerFactory.getLogger(StripeWebhookHandler.class);

    static final String TICKET_ID_METADATA = "ticket_id";

    private final ConfirmPaymentUseCase confirmPaymentUseCase;
    private final HandleProviderEventUseCase handleProviderEventUseCase;
    private final String webhookSecret;

    public StripeWebhookHandler(ConfirmPaymentUseCase confirmPaymentUseCase,
                                HandleProviderEventUseCase handleProviderEventUseCase,
                                @Value("${zevent.stripe.webhook-secret}") String webhookSecret) {
        this.confirmPaymentUseCase = confirmPaymentUseCase;
        this.handleProviderEventUseCase = handleProviderEventUseCase;
        this.webhookSecret = webhookSecret;
    }

    public WebhookResult handle(String payload, String signatureHeader) {
        Event event = verify(payload, signatureHeader);
        String type = event.getType();
        log.info("Stripe 웹훅 수신: id={}, type={}", event.getId(), type);

        return switch (type) {
            case "checkout.session.completed", "checkout.session.async_payment_succeeded" ->
                    dataObject(event, Session.class).map(this::onSessionPaid).orElse(WebhookResult.IGNORED);
            case "checkout.session.expired" ->
                    dataObject(event, Session.class).map(this::onSessionExpired).orElse(WebhookResult.IGNORED);
            case "charge.refunded" ->
                    dataObject(event, Charge.class).map(this::onChargeRefunded).orElse(WebhookResult.IGNORED);
            default -> {
                log.debug("처리하지 않는 Stripe 이벤트: id={}, type={}", event.getId(), type);
                yield WebhookResult.IGNORED;
            }
        };
    }

    private Event verify(String payload, String signatureHeader) {
        if (!StringUtils.hasText(webhookSecret)) {
            log.warn("Stripe 웹훅 시크릿 미설정, 요청 거부");
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        }
        if (!StringUtils.hasText(signatureHeader)) {
            log.warn("Stripe-Signature 헤더 없음, 요청 거부");
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        }
        try {
            return Webhook.constructEvent(payload, signatureHeader, webhookSecret);
        } catch (SignatureVerificationException e) {
            log.warn("Stripe 웹훅 서명 검증 실패: {}", e.getMessage());
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        }
    }

    private WebhookResult onSessionPaid(Session session) {
        if (!"paid".equals(session.getPaymentStatus())) {
            // 지연 결제 수단은 async_payment_succeeded로 다시 온다
            log.info("Stripe 세션 완료, 결제 대기: sessionId={}, paymentStatus={}",
                    session.getId(), session.getPaymentStatus());
            return WebhookResult.IGNORED;
        }
        Optional<Long> ticketId = ticketId(session);
        if (ticketId.isEmpty()) {
            log.warn("Stripe 세션에 ticket_id 없음: sessionId={}", session.getId());
            return WebhookResult.IGNORED;
        }
        PaymentReference reference = new PaymentReference(
                PaymentProviderType.STRIPE, session.getId(), session.getPaymentIntent());
        ConfirmationResult result = confirmPaymentUseCase.confirmPayment(ticketId.get(), reference);
        log.info("Stripe 웹훅 결제 확정: ticketId={}, result={}", ticketId.get(), result);
        return WebhookResult.PROCESSED;
    }

    private WebhookResult onSessionExpired(Session session) {
        Optional<Long> ticketId = ticketId(session);
        if (ticketId.isEmpty()) {
            return WebhookResult.IGNORED;
        }
        handleProviderEventUseCase.expireCheckout(ticketId.get(), PaymentProviderType.STRIPE, session.getId());
        return WebhookResult.PROCESSED;
    }

    private WebhookResult onChargeRefunded(Charge charge) {
        if (!StringUtils.hasText(charge.getPaymentIntent()) || charge.getAmountRefunded() == null) {
            return WebhookResult.IGNORED;
        }
        handleProviderEventUseCase.recordProviderRefund(
                PaymentProviderType.STRIPE,
                charge.getPaymentIntent(),
                Money.fromMinorUnits(charge.getAmountRefunded()));
        return WebhookResult.PROCESSED;
    }

    private Optional<Long> ticketId(Session session) {
        String value = session.getMetadata() != null ? session.getMetadata().get(TICKET_ID_METADATA) : null;
        if (!StringUtils.hasText(value)) {
            value = session.getClientReferenceId();
        }
        if (!StringUtils.hasText(value)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Stripe 세션의 ticket_id 형식 오류: sessionId={}, value={}", session.getId(), value);
            return Optional.empty();
        }
    }

    private <T extends StripeObject> Optional<T> dataObject(Event event, Class<T> type) {
        EventDataObjectDeserializer deserializer = event.getDataObjectDeserializer();
        StripeObject object = deserializer.getObject().orElse(null);
        if (object == null) {
            // API 버전이 라이브러리와 다른 이벤트
            try {
                object = deserializer.deserializeUnsafe();
            } catch (EventDataObjectDeserializationException e) {
                log.error("Stripe 이벤트 객체 역직렬화 실패: id={}, type={}", event.getId(), event.getType(), e);
                return Optional.empty();
            }
        }
        return type.isInstance(object) ? Optional.of(type.cast(object)) : Optional.empty();
    }
}
