package kr.jemi.zevent.integration;

import com.stripe.model.checkout.Session;
import com.stripe.param.checkout.SessionCreateParams;
import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import kr.jemi.zevent.ticket.application.port.in.CancelTicketUseCase;
import kr.jemi.zevent.ticket.application.port.in.CheckoutResult;
import kr.jemi.zevent.ticket.application.port.in.ConfirmPaymentUseCase;
import kr.jemi.zevent.ticket.application.port.in.CreateTicketUseCase;
import kr.jemi.zevent.ticket.application.port.in.CreateTicketUseCase.CreateTicketCommand;
import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.CancellationMode;
import kr.jemi.zevent.ticket.domain.CancellationResult;
import kr.jemi.zevent.ticket.domain.ConfirmationResult;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.PaymentReference;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;

import java.math.BigDecimal;
import java.util.Optional;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;

@ExtendWith(OutputCaptureExtension.class)
class TicketLifecycleIntegrationTest extends IntegrationTestBase {

    @Autowired
    CreateTicketUseCase createTicketUseCase;

    @Autowired
    CancelTicketUseCase cancelTicketUseCase;

    @Autowired
    ConfirmPaymentUseCase confirmPaymentUseCase;

    @Autowired
    TicketPort ticketPort;

    @BeforeEach
    void setUp() throws Exception {
        givenEvent(2, now().plusDays(60));
        givenBuyer(1L, "guests");
        givenBuyer(2L, "guests");
        givenBuyer(3L, "guests");

        Session created = new Session();
        created.setId("cs_it_1");
        created.setUrl("https://checkout.stripe.com/c/pay/cs_it_1");
        given(stripeClient.checkout().sessions().create(any(SessionCreateParams.class))).willReturn(created);
    }

    private void givenRemoteSession(String paymentStatus, String status) throws Exception {
        Session remote = new Session();
        remote.setId("cs_it_1");
        remote.setPaymentStatus(paymentStatus);
        remote.setStatus(status);
        remote.setPaymentIntent("paid".equals(paymentStatus) ? "pi_it_1" : null);
        given(stripeClient.checkout().sessions().retrieve(anyString())).willReturn(remote);
    }

    private CreateTicketCommand purchase(long userId) {
        return new CreateTicketCommand(userId, EVENT_ID, false, null, PaymentProviderType.STRIPE);
    }

    @Test
    @DisplayName("결제 세션 생성 후 폴러가 결제를 확인하면 paid로 전환되고 확인 메일이 나간다")
    void poller_confirms_payment(CapturedOutput output) throws Exception {
        givenRemoteSession("paid", "complete");

        CheckoutResult result = createTicketUseCase.create(purchase(1L));

        assertThat(result.ticket().getStatus()).isEqualTo(TicketStatus.PENDING);
        assertThat(result.checkoutUrl()).isEqualTo("https://checkout.stripe.com/c/pay/cs_it_1");

        await().atMost(10, SECONDS).untilAsserted(() -> {
            assertThat(ticketPort.findById(result.ticket().getId()))
                    .as("DB 티켓 상태")
                    .hasValueSatisfying(ticket -> {
                        assertThat(ticket.getStatus()).isEqualTo(TicketStatus.PAID);
                        assertThat(ticket.getStripePaymentIntentId()).isEqualTo("pi_it_1");
                    });
            assertThat(output.getAll())
                    .as("구매 확인 메일")
                    .contains("구매 확인 메일: userId=1");
        });
    }

    @Test
    @DisplayName("결제 중인 티켓을 취소하면 유예 기간 후 cancelled로 확정된다")
    void pending_cancellation_finalizes_after_grace_period() throws Exception {
        givenRemoteSession("unpaid", "open");
        CheckoutResult result = createTicketUseCase.create(purchase(1L));
        long ticketId = result.ticket().getId();

        CancellationResult cancellation = cancelTicketUseCase.cancel(ticketId, 1L, CancellationMode.AUTO);

        assertThat(cancellation.outcome()).isEqualTo(CancellationResult.Outcome.GRACE_PERIOD);
        assertThat(ticketPort.findById(ticketId))
                .hasValueSatisfying(ticket -> assertThat(ticket.getStatus()).isEqualTo(TicketStatus.PENDING_CANCELLATION));

        await().atMost(10, SECONDS).untilAsserted(() ->
                assertThat(ticketPort.findById(ticketId))
                        .hasValueSatisfying(ticket -> {
                            assertThat(ticket.getStatus()).isEqualTo(TicketStatus.CANCELLED);
                            assertThat(Optional.ofNullable(ticket.getRefundedAmount()).orElse(BigDecimal.ZERO))
                                    .as("환불액")
                                    .isEqualByComparingTo(BigDecimal.ZERO);
                            assertThat(ticket.getRefundedAt()).isNull();
                        })
        );
    }

    @Test
    @DisplayName("유예 기간 중 결제가 확정되면 paid로 복구되고 마감 시각이 지나도 paid로 남는다")
    void payment_during_grace_period_reactivates_ticket() throws Exception {
        givenRemoteSession("unpaid", "open");
        CheckoutResult result = createTicketUseCase.create(purchase(1L));
        long ticketId = result.ticket().getId();
        cancelTicketUseCase.cancel(ticketId, 1L, CancellationMode.AUTO);

        ConfirmationResult confirmation = confirmPaymentUseCase.confirmPayment(ticketId,
                new PaymentReference(PaymentProviderType.STRIPE, "cs_it_1", "pi_it_1"));

        assertThat(confirmation).isEqualTo(ConfirmationResult.REACTIVATED);
        assertThat(ticketPort.findById(ticketId)).hasValueSatisfying(ticket -> {
            assertThat(ticket.getStatus()).isEqualTo(TicketStatus.PAID);
            assertThat(ticket.getCancelledAt()).as("취소 표시 해제").isNull();
            assertThat(ticket.getStripePaymentIntentId()).isEqualTo("pi_it_1");
        });

        // 유예 기간(PT2S)이 지난 뒤에도 타이머가 상태를 바꾸지 않는다
        await().during(3, SECONDS).atMost(5, SECONDS).untilAsserted(() ->
                assertThat(ticketPort.findById(ticketId))
                        .hasValueSatisfying(ticket -> assertThat(ticket.getStatus()).isEqualTo(TicketStatus.PAID))
        );
    }

    @Test
    @DisplayName("같은 이벤트에 유효한 티켓이 있으면 DUPLICATE_TICKET")
    void duplicate_ticket_rejected() throws Exception {
        givenRemoteSession("unpaid", "open");
        createTicketUseCase.create(purchase(1L));

        assertThatThrownBy(() -> createTicketUseCase.create(purchase(1L)))
                .isInstanceOfSatisfying(BusinessException.class, e ->
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.DUPLICATE_TICKET)
                );
    }

    @Test
    @DisplayName("정원이 찬 이벤트는 EVENT_SOLD_OUT")
    void sold_out_rejected() throws Exception {
        givenRemoteSession("unpaid", "open");
        createTicketUseCase.create(purchase(1L));
        createTicketUseCase.create(purchase(2L));

        assertThatThrownBy(() -> createTicketUseCase.create(purchase(3L)))
                .isInstanceOfSatisfying(BusinessException.class, e ->
                        assertThat(e.getErrorCode()).isEqualTo(ErrorCode.EVENT_SOLD_OUT)
                );
        assertThat(ticketJpaRepository.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("픽업 포함 구매는 이벤트 가격에 픽업 요금을 더한다")
    void pickup_is_added_to_total() throws Exception {
        givenRemoteSession("unpaid", "open");

        CheckoutResult result = createTicketUseCase.create(
                new CreateTicketCommand(1L, EVENT_ID, true, "Hauptbahnhof", PaymentProviderType.STRIPE));

        assertThat(result.ticket().getTotalAmount()).isEqualByComparingTo(new BigDecimal("45.00"));
    }
}
