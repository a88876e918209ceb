package kr.jemi.zevent.ticket.infrastructure.out.payment.stripe;

import com.stripe.StripeClient;
import com.stripe.exception.ApiConnectionException;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.param.RefundCreateParams;
import com.stripe.param.checkout.SessionCreateParams;
import kr.jemi.zevent.ticket.application.port.out.CheckoutSession;
import kr.jemi.zevent.ticket.application.port.out.PaymentCheck;
import kr.jemi.zevent.ticket.application.port.out.PaymentProviderException;
import kr.jemi.zevent.ticket.domain.Buyer;
import kr.jemi.zevent.ticket.domain.BuyerGroup;
import kr.jemi.zevent.ticket.domain.CaptureOutcome;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.PaymentReference;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Answers;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

import static kr.jemi.zevent.ticket.domain.TicketFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class StripePaymentAdapterTest {

    @Mock(answer = Answers.RETURNS_DEEP_STUBS)
    private StripeClient stripeClient;

    private StripePaymentAdapter adapter;

    private final Buyer buyer = new Buyer(USER_ID, "buyer@zevent.test", BuyerGroup.GUESTS);

    @BeforeEach
    void setUp() {
        StripeProperties properties = new StripeProperties("sk_test_x", "whsec_x",
                "https://zevent.test/success", "https://zevent.test/cancel");
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        adapter = new StripePaymentAdapter(stripeClient, properties, clock, Duration.ofMinutes(30));
    }

    @Nested
    @DisplayName("createCheckout()")
    class CreateCheckout {

        @Test
        @DisplayName("티켓과 픽업을 센트 단위 항목으로 만들고 ticket_id 메타데이터를 붙인다")
        void shouldCreateSessionWithLineItems() throws Exception {
            Session session = new Session();
            session.setId("cs_test_1");
            session.setUrl("https://checkout.stripe.com/c/pay/cs_test_1");
            given(stripeClient.checkout().sessions().create(any(SessionCreateParams.class))).willReturn(session);

            CheckoutSession result = adapter.createCheckout(
                    withPickup(1L, TicketStatus.PENDING), event(NOW.plusDays(30)), buyer, new BigDecimal("45.00"));

            ArgumentCaptor<SessionCreateParams> captor = ArgumentCaptor.forClass(SessionCreateParams.class);
            then(stripeClient.checkout().sessions()).should().create(captor.capture());
            SessionCreateParams params = captor.getValue();
            assertThat(params.getLineItems()).hasSize(2);
            assertThat(params.getLineItems().get(0).getPriceData().getUnitAmount()).isEqualTo(3500L);
            assertThat(params.getLineItems().get(1).getPriceData().getUnitAmount()).isEqualTo(1000L);
            assertThat(params.getMetadata()).containsEntry("ticket_id", "1");
            assertThat(params.getClientReferenceId()).isEqualTo("1");
            assertThat(params.getExpiresAt())
                    .isEqualTo(NOW.plusMinutes(31).toEpochSecond(ZoneOffset.UTC));

            assertThat(result.checkoutUrl()).isEqualTo("https://checkout.stripe.com/c/pay/cs_test_1");
            assertThat(result.reference()).isEqualTo(PaymentReference.checkout(PaymentProviderType.STRIPE, "cs_test_1"));
        }

        @Test
        @DisplayName("항목 합계가 총액과 다르면 세션을 만들지 않는다")
        void shouldRejectMismatchedTotal() {
            assertThatThrownBy(() -> adapter.createCheckout(
                    pendingWithoutCheckout(1L), event(NOW.plusDays(30)), buyer, new BigDecimal("40.00")))
                    .isInstanceOf(PaymentProviderException.class);
        }

        @Test
        @DisplayName("Stripe 오류는 PaymentProviderException으로 감싼다")
        void shouldWrapStripeException() throws Exception {
            given(stripeClient.checkout().sessions().create(any(SessionCreateParams.class)))
                    .willThrow(new ApiConnectionException("timeout"));

            assertThatThrownBy(() -> adapter.createCheckout(
                    pendingWithoutCheckout(1L), event(NOW.plusDays(30)), buyer, new BigDecimal("35.00")))
                    .isInstanceOf(PaymentProviderException.class)
                    .hasMessageContaining("timeout");
        }
    }

    @Nested
    @DisplayName("checkAndCaptureOrder()")
    class CheckAndCapture {

        @Test
        @DisplayName("payment_status=paid면 PaymentIntent ID와 함께 CAPTURED")
        void shouldReportCaptured() throws Exception {
            Session session = new Session();
            session.setId("cs_test_1");
            session.setPaymentStatus("paid");
            session.setStatus("complete");
            session.setPaymentIntent("pi_test_1");
            given(stripeClient.checkout().sessions().retrieve("cs_test_1")).willReturn(session);

            PaymentCheck check = adapter.checkAndCaptureOrder(pendingStripe(1L));

            assertThat(check.outcome()).isEqualTo(CaptureOutcome.CAPTURED);
            assertThat(check.reference().paymentId()).isEqualTo("pi_test_1");
        }

        @Test
        @DisplayName("만료된 세션은 ABANDONED")
        void shouldReportAbandoned() throws Exception {
            Session session = new Session();
            session.setId("cs_test_1");
            session.setPaymentStatus("unpaid");
            session.setStatus("expired");
            given(stripeClient.checkout().sessions().retrieve("cs_test_1")).willReturn(session);

            assertThat(adapter.checkAndCaptureOrder(pendingStripe(1L)).outcome()).isEqualTo(CaptureOutcome.ABANDONED);
        }

        @Test
        @DisplayName("세션이 없으면 Stripe를 호출하지 않고 PENDING")
        void shouldReturnPendingWithoutSession() {
            assertThat(adapter.checkAndCaptureOrder(pendingWithoutCheckout(1L)).outcome())
                    .isEqualTo(CaptureOutcome.PENDING);
        }
    }

    @Nested
    @DisplayName("processRefund()")
    class ProcessRefund {

        @Test
        @DisplayName("PaymentIntent 기준으로 센트 단위 부분 환불을 요청하고 멱등 키를 붙인다")
        void shouldRefundPartially() throws Exception {
            adapter.processRefund(paidStripe(1L), new BigDecimal("17.50"));

            ArgumentCaptor<RefundCreateParams> params = ArgumentCaptor.forClass(RefundCreateParams.class);
            ArgumentCaptor<RequestOptions> options = ArgumentCaptor.forClass(RequestOptions.class);
            then(stripeClient.refunds()).should().create(params.capture(), options.capture());
            assertThat(params.getValue().getPaymentIntent()).isEqualTo("pi_test_1");
            assertThat(params.getValue().getAmount()).isEqualTo(1750L);
            assertThat(options.getValue().getIdempotencyKey()).isEqualTo("refund-1-1750");
        }

        @Test
        @DisplayName("PaymentIntent ID가 없으면 환불할 수 없다")
        void shouldFailWithoutPaymentIntent() {
            assertThatThrownBy(() -> adapter.processRefund(pendingStripe(1L), new BigDecimal("35.00")))
                    .isInstanceOf(PaymentProviderException.class);
        }
    }
}
