package kr.jemi.zevent.integration;

import com.stripe.Stripe;
import com.stripe.model.checkout.Session;
import com.stripe.net.Webhook;
import com.stripe.param.checkout.SessionCreateParams;
import kr.jemi.zevent.ticket.application.port.in.CancelTicketUseCase;
import kr.jemi.zevent.ticket.application.port.in.CreateTicketUseCase;
import kr.jemi.zevent.ticket.application.port.in.CreateTicketUseCase.CreateTicketCommand;
import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.CancellationMode;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class StripeWebhookIntegrationTest extends IntegrationTestBase {

    private static final String WEBHOOK_SECRET = "whsec_test_secret";

    @Autowired
    MockMvc mockMvc;

    @Autowired
    CreateTicketUseCase createTicketUseCase;

    @Autowired
    CancelTicketUseCase cancelTicketUseCase;

    @Autowired
    TicketPort ticketPort;

    private long ticketId;

    @BeforeEach
    void setUp() throws Exception {
        givenEvent(10, now().plusDays(60));
        givenBuyer(1L, "bubble");

        Session created = new Session();
        created.setId("cs_it_hook");
        created.setUrl("https://checkout.stripe.com/c/pay/cs_it_hook");
        Session open = new Session();
        open.setId("cs_it_hook");
        open.setPaymentStatus("unpaid");
        open.setStatus("open");
        given(stripeClient.checkout().sessions().create(any(SessionCreateParams.class))).willReturn(created);
        given(stripeClient.checkout().sessions().retrieve(anyString())).willReturn(open);

        ticketId = createTicketUseCase.create(
                new CreateTicketCommand(1L, EVENT_ID, false, null, PaymentProviderType.STRIPE)).ticket().getId();
    }

    @Test
    @DisplayName("서명된 checkout.session.completed 웹훅으로 티켓이 paid가 된다")
    void completed_webhook_marks_paid() throws Exception {
        String payload = completedEvent(ticketId);

        mockMvc.perform(post("/webhooks/stripe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", sign(payload))
                        .content(payload))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result").value("processed"));

        assertThat(ticketPort.findById(ticketId)).hasValueSatisfying(ticket -> {
            assertThat(ticket.getStatus()).isEqualTo(TicketStatus.PAID);
            assertThat(ticket.getStripePaymentIntentId()).isEqualTo("pi_it_hook");
        });
    }

    @Test
    @DisplayName("같은 웹훅이 두 번 와도 결과는 한 번 처리한 것과 같다")
    void duplicate_webhook_is_idempotent() throws Exception {
        String payload = completedEvent(ticketId);

        for (int i = 0; i < 2; i++) {
            mockMvc.perform(post("/webhooks/stripe")
                            .contentType(MediaType.APPLICATION_JSON)
                            .header("Stripe-Signature", sign(payload))
                            .content(payload))
                    .andExpect(status().isOk());
        }

        assertThat(ticketPort.findById(ticketId))
                .hasValueSatisfying(ticket -> assertThat(ticket.getStatus()).isEqualTo(TicketStatus.PAID));
    }

    @Test
    @DisplayName("취소 유예 중에 결제 웹훅이 오면 티켓이 paid로 복구된다")
    void payment_during_grace_period_reactivates_ticket() throws Exception {
        cancelTicketUseCase.cancel(ticketId, 1L, CancellationMode.AUTO);
        String payload = completedEvent(ticketId);

        mockMvc.perform(post("/webhooks/stripe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", sign(payload))
                        .content(payload))
                .andExpect(status().isOk());

        assertThat(ticketPort.findById(ticketId))
                .hasValueSatisfying(ticket -> assertThat(ticket.getStatus()).isEqualTo(TicketStatus.PAID));
    }

    @Test
    @DisplayName("서명이 틀린 웹훅은 400이고 티켓은 그대로다")
    void forged_webhook_rejected() throws Exception {
        String payload = completedEvent(ticketId);

        mockMvc.perform(post("/webhooks/stripe")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("Stripe-Signature", "t=" + Instant.now().getEpochSecond() + ",v1=deadbeef")
                        .content(payload))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_WEBHOOK_SIGNATURE"));

        assertThat(ticketPort.findById(ticketId))
                .hasValueSatisfying(ticket -> assertThat(ticket.getStatus()).isEqualTo(TicketStatus.PENDING));
    }

    private static String completedEvent(long ticketId) {
        return """
                {
                  "id": "evt_it_1",
                  "object": "event",
                  "api_version": "%s",
                  "type": "checkout.session.completed",
                  "data": {
                    "object": {
                      "id": "cs_it_hook",
                      "object": "checkout.session",
                      "payment_status": "paid",
                      "status": "complete",
                      "payment_intent": "pi_it_hook",
                      "client_reference_id": "%d",
                      "metadata": { "ticket_id": "%d" }
                    }
                  }
                }
                """.formatted(Stripe.API_VERSION, ticketId, ticketId);
    }

    private static String sign(String payload) throws Exception {
        long timestamp = Instant.now().getEpochSecond();
        return "t=" + timestamp + ",v1=" + Webhook.Util.computeHmacSha256(WEBHOOK_SECRET, timestamp + "." + payload);
    }
}
