package kr.jemi.zevent.ticket.infrastructure.in.webhook;

import com.stripe.Stripe;
import com.stripe.net.Webhook;
import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import kr.jemi.zevent.ticket.application.port.in.ConfirmPaymentUseCase;
import kr.jemi.zevent.ticket.application.port.in.HandleProviderEventUseCase;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.PaymentReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class StripeWebhookHandlerTest {

    private static final String SECRET = "whsec_test_secret";

    @Mock
    private ConfirmPaymentUseCase confirmPaymentUseCase;

    @Mock
    private HandleProviderEventUseCase handleProviderEventUseCase;

    private StripeWebhookHandler handler;

    @BeforeEach
    void setUp() {
        handler = new StripeWebhookHandler(confirmPaymentUseCase, handleProviderEventUseCase, SECRET);
    }

    @Nested
    @DisplayName("서명 검증")
    class Signature {

        @Test
        @DisplayName("서명 헤더가 없으면 거부한다")
        void shouldRejectMissingHeader() {
            assertThatThrownBy(() -> handler.handle(sessionEvent("checkout.session.completed", "paid"), null))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        }

        @Test
        @DisplayName("다른 시크릿으로 서명한 요청은 거부하고 아무것도 처리하지 않는다")
        void shouldRejectForgedSignature() throws Exception {
            String payload = sessionEvent("checkout.session.completed", "paid");

            assertThatThrownBy(() -> handler.handle(payload, sign(payload, "whsec_other")))
                    .isInstanceOf(BusinessException.class)
                    .extracting(e -> ((BusinessException) e).getErrorCode())
                    .isEqualTo(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
            then(confirmPaymentUseCase).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("시크릿이 설정되지 않았으면 모든 요청을 거부한다")
        void shouldRejectWhenSecretMissing() throws Exception {
            StripeWebhookHandler unconfigured =
                    new StripeWebhookHandler(confirmPaymentUseCase, handleProviderEventUseCase, "");
            String payload = sessionEvent("checkout.session.completed", "paid");

            assertThatThrownBy(() -> unconfigured.handle(payload, sign(payload, SECRET)))
                    .isInstanceOf(BusinessException.class);
        }
    }

    @Nested
    @DisplayName("이벤트 처리")
    class Events {

        @Test
        @DisplayName("checkout.session.completed(paid)는 세션/PaymentIntent ID로 결제를 확정한다")
        void shouldConfirmPaidSession() throws Exception {
            String payload = sessionEvent("checkout.session.completed", "paid");

            WebhookResult result = handler.handle(payload, sign(payload, SECRET));

            assertThat(result).isEqualTo(WebhookResult.PROCESSED);
            then(confirmPaymentUseCase).should().confirmPayment(1L,
                    new PaymentReference(PaymentProviderType.STRIPE, "cs_test_1", "pi_test_1"));
        }

        @Test
        @DisplayName("결제가 아직 끝나지 않은 세션 완료 이벤트는 무시한다")
        void shouldIgnoreUnpaidSession() throws Exception {
            String payload = sessionEvent("checkout.session.completed", "unpaid");

            WebhookResult result = handler.handle(payload, sign(payload, SECRET));

            assertThat(result).isEqualTo(WebhookResult.IGNORED);
            then(confirmPaymentUseCase).shouldHaveNoInteractions();
        }

        @Test
        @DisplayName("checkout.session.expired는 세션 만료로 넘긴다")
        void shouldExpireSession() throws Exception {
            String payload = sessionEvent("checkout.session.expired", "unpaid");

            WebhookResult result = handler.handle(payload, sign(payload, SECRET));

            assertThat(result).isEqualTo(WebhookResult.PROCESSED);
            then(handleProviderEventUseCase).should().expireCheckout(1L, PaymentProviderType.STRIPE, "cs_test_1");
        }

        @Test
        @DisplayName("charge.refunded는 센트 단위 환불액을 유로로 바꿔 기록한다")
        void shouldRecordRefund() throws Exception {
            String payload = """
                    {
                      "id": "evt_test_refund",
                      "object": "event",
                      "api_version": "%s",
                      "type": "charge.refunded",
                      "data": {
                        "object": {
                          "id": "ch_test_1",
                          "object": "charge",
                          "payment_intent": "pi_test_1",
                          "amount_refunded": 1750
                        }
                      }
                    }
                    """.formatted(Stripe.API_VERSION);

            WebhookResult result = handler.handle(payload, sign(payload, SECRET));

            assertThat(result).isEqualTo(WebhookResult.PROCESSED);
            then(handleProviderEventUseCase).should()
                    .recordProviderRefund(PaymentProviderType.STRIPE, "pi_test_1", new BigDecimal("17.50"));
        }

        @Test
        @DisplayName("처리 대상이 아닌 이벤트는 IGNORED")
        void shouldIgnoreUnknownType() throws Exception {
            String payload = sessionEvent("customer.created", "paid");

            WebhookResult result = handler.handle(payload, sign(payload, SECRET));

            assertThat(result).isEqualTo(WebhookResult.IGNORED);
            then(confirmPaymentUseCase).should(never()).confirmPayment(anyLong(), any());
        }
    }

    private static String sessionEvent(String type, String paymentStatus) {
        return """
                {
                  "id": "evt_test_1",
                  "object": "event",
                  "api_version": "%s",
                  "type": "%s",
                  "data": {
                    "object": {
                      "id": "cs_test_1",
                      "object": "checkout.session",
                      "payment_status": "%s",
                      "payment_intent": "pi_test_1",
                      "client_reference_id": "1",
                      "metadata": { "ticket_id": "1" }
                    }
                  }
                }
                """.formatted(Stripe.API_VERSION, type, paymentStatus);
    }

    private static String sign(String payload, String secret) throws Exception {
        long timestamp = Instant.now().getEpochSecond();
        String signature = Webhook.Util.computeHmacSha256(secret, timestamp + "." + payload);
        return "t=" + timestamp + ",v1=" + signature;
    }
}
