package kr.jemi.zevent.ticket.infrastructure.in.webhook;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import kr.jemi.zevent.ticket.application.port.in.CheckPaymentUseCase;
import kr.jemi.zevent.ticket.application.port.in.ConfirmPaymentUseCase;
import kr.jemi.zevent.ticket.application.port.in.HandleProviderEventUseCase;
import kr.jemi.zevent.ticket.domain.CaptureOutcome;
import kr.jemi.zevent.ticket.domain.ConfirmationResult;
import kr.jemi.zevent.ticket.domain.Money;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.PaymentReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@ConditionalOnProperty(prefix = "zevent.paypal", name = "enabled", havingValue = "true")
public class PayPalWebhookHandler {

    private static final Logger log = LoggerFactory.getLogger(PayPalWebhookHandler.class);

    private final PayPalWebhookVerifier verifier;
    private final ObjectMapper objectMapper;
    private final ConfirmPaymentUseCase confirmPaymentUseCase;
    private final CheckPaymentUseCase checkPaymentUseCase;
    private final HandleProviderEventUseCase handleProviderEventUseCase;

    public PayPalWebhookHandler(PayPalWebhookVerifier verifier,
                                ObjectMapper objectMapper,
                                ConfirmPaymentUseCase confirmPaymentUseCase,
                                CheckPaymentUseCase checkPaymentUseCase,
                                HandleProviderEventUseCase handleProviderEventUseCase) {
        this.verifier = verifier;
        this.objectMapper = objectMapper;
        this.confirmPaymentUseCase = confirmPaymentUseCase;
        this.checkPaymentUseCase = checkPaymentUseCase;
        this.handleProviderEventUseCase = handleProviderEventUseCase;
    }

    public WebhookResult handle(String payload, PayPalTransmission transmission) {
        verifier.verify(transmission, payload);

        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("PayPal 웹훅 본문 파싱 실패: {}", e.getOriginalMessage());
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "웹훅 본문이 올바른 JSON이 아닙니다");
        }
        String eventType = root.path("event_type").asText("");
        JsonNode resource = root.path("resource");
        log.info("PayPal 웹훅 수신: id={}, type={}", root.path("id").asText(), eventType);

        return switch (eventType) {
            case "PAYMENT.CAPTURE.COMPLETED" -> onCaptureCompleted(resource);
            case "CHECKOUT.ORDER.APPROVED" -> onOrderApproved(resource);
            case "PAYMENT.CAPTURE.DENIED" -> {
                // 티켓은 재시도나 stale 정리에 맡긴다
                log.warn("PayPal 결제 거절: captureId={}, customId={}",
                        resource.path("id").asText(), resource.path("custom_id").asText());
                yield WebhookResult.PROCESSED;
            }
            case "PAYMENT.CAPTURE.REFUNDED" -> onCaptureRefunded(resource);
            default -> {
                log.debug("처리하지 않는 PayPal 이벤트: type={}", eventType);
                yield WebhookResult.IGNORED;
            }
        };
    }

    private WebhookResult onCaptureCompleted(JsonNode capture) {
        Optional<Long> ticketId = parseTicketId(capture.path("custom_id").asText(null));
        String captureId = capture.path("id").asText(null);
        if (ticketId.isEmpty() || captureId == null) {
            log.warn("PayPal 캡처 이벤트에 custom_id 또는 id 없음");
            return WebhookResult.IGNORED;
        }
        String orderId = capture.path("supplementary_data").path("related_ids").path("order_id").asText(null);
        PaymentReference reference = new PaymentReference(PaymentProviderType.PAYPAL, orderId, captureId);
        ConfirmationResult result = confirmPaymentUseCase.confirmPayment(ticketId.get(), reference);
        log.info("PayPal 웹훅 결제 확정: ticketId={}, captureId={}, result={}", ticketId.get(), captureId, result);
        return WebhookResult.PROCESSED;
    }

    private WebhookResult onOrderApproved(JsonNode order) {
        JsonNode units = order.path("purchase_units");
        String customId = units.isArray() && units.size() > 0 ? units.get(0).path("custom_id").asText(null) : null;
        Optional<Long> ticketId = parseTicketId(customId);
        if (ticketId.isEmpty()) {
            log.warn("PayPal 주문 승인 이벤트에 custom_id 없음: orderId={}", order.path("id").asText());
            return WebhookResult.IGNORED;
        }
        try {
            CaptureOutcome outcome = checkPaymentUseCase.checkPayment(ticketId.get());
            log.info("PayPal 주문 승인 후 캡처 시도: ticketId={}, outcome={}", ticketId.get(), outcome);
        } catch (BusinessException e) {
            if (e.getErrorCode() != ErrorCode.TICKET_NOT_FOUND) {
                throw e;
            }
            log.warn("PayPal 주문 승인 이벤트의 티켓 없음: ticketId={}", ticketId.get());
            return WebhookResult.IGNORED;
        }
        return WebhookResult.PROCESSED;
    }

    private WebhookResult onCaptureRefunded(JsonNode refund) {
        Optional<String> captureId = captureIdFromLinks(refund);
        String value = refund.path("amount").path("value").asText(null);
        if (captureId.isEmpty() || value == null) {
            log.warn("PayPal 환불 이벤트에서 캡처 ID 또는 금액을 찾을 수 없음: refundId={}", refund.path("id").asText());
            return WebhookResult.IGNORED;
        }
        handleProviderEventUseCase.recordProviderRefund(PaymentProviderType.PAYPAL, captureId.get(), Money.of(value));
        return WebhookResult.PROCESSED;
    }

    // 환불 리소스는 원 캡처를 rel=up 링크로만 가리킨다
    private Optional<String> captureIdFromLinks(JsonNode refund) {
        for (JsonNode link : refund.path("links")) {
            if ("up".equals(link.path("rel").asText())) {
                String href = link.path("href").asText("");
                int slash = href.lastIndexOf('/');
                if (slash >= 0 && slash < href.length() - 1) {
                    return Optional.of(href.substring(slash + 1));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Long> parseTicketId(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("PayPal custom_id 형식 오류: {}", value);
            return Optional.empty();
        }
    }
}
