package kr.jemi.zevent.ticket.application.service;

import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.PaymentReference;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.Optional;

import static kr.jemi.zevent.ticket.domain.TicketFixtures.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class ProviderEventServiceTest {

    @Mock
    private TicketPort ticketPort;

    @Mock
    private ReconciliationPoller reconciliationPoller;

    @Mock
    private GracePeriodCanceller gracePeriodCanceller;

    private ProviderEventService service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        service = new ProviderEventService(ticketPort, reconciliationPoller, gracePeriodCanceller, clock);
    }

    @Nested
    @DisplayName("expireCheckout() - 결제 세션 만료")
    class ExpireCheckout {

        @Test
        @DisplayName("pending 티켓을 cancelled로 전환하고 폴러를 멈춘다")
        void shouldCancelPendingTicket() {
            given(ticketPort.findById(1L)).willReturn(Optional.of(pendingStripe(1L)));
            given(ticketPort.cancel(1L, TicketStatus.PENDING, NOW)).willReturn(true);

            service.expireCheckout(1L, PaymentProviderType.STRIPE, "cs_test_1");

            then(reconciliationPoller).should().stop(1L);
            then(gracePeriodCanceller).should().cancelTimer(1L);
        }

        @Test
        @DisplayName("paid 티켓은 건드리지 않는다")
        void shouldIgnorePaidTicket() {
            given(ticketPort.findById(1L)).willReturn(Optional.of(paidStripe(1L)));

            service.expireCheckout(1L, PaymentProviderType.STRIPE, "cs_test_1");

            then(ticketPort).should(never()).cancel(anyLong(), any(), any());
        }

        @Test
        @DisplayName("다른 결제사의 만료 이벤트는 무시한다")
        void shouldIgnoreOtherProvider() {
            given(ticketPort.findById(1L)).willReturn(Optional.of(pendingPaypal(1L)));

            service.expireCheckout(1L, PaymentProviderType.STRIPE, "cs_test_1");

            then(ticketPort).should(never()).cancel(anyLong(), any(), any());
        }

        @Test
        @DisplayName("재시도로 교체된 이전 세션이 만료돼도 현재 세션의 티켓은 취소하지 않는다")
        void shouldIgnoreReplacedSession() {
            given(ticketPort.findById(1L)).willReturn(Optional.of(pendingStripe(1L)));

            service.expireCheckout(1L, PaymentProviderType.STRIPE, "cs_test_old");

            then(ticketPort).should(never()).cancel(anyLong(), any(), any());
            then(reconciliationPoller).shouldHaveNoInteractions();
        }
    }

    @Nested
    @DisplayName("recordProviderRefund() - 결제사 측 환불")
    class RecordProviderRefund {

        private final PaymentReference intentRef =
                new PaymentReference(PaymentProviderType.STRIPE, null, "pi_test_1");

        @Test
        @DisplayName("paid 티켓은 환불 금액과 함께 refunded로 전환한다")
        void shouldMarkRefunded() {
            given(ticketPort.findByPaymentId(intentRef)).willReturn(Optional.of(paidStripe(1L)));

            service.recordProviderRefund(PaymentProviderType.STRIPE, "pi_test_1", new BigDecimal("20.00"));

            then(ticketPort).should().markRefunded(1L, new BigDecimal("20.00"), NOW);
        }

        @Test
        @DisplayName("총액보다 큰 환불 알림은 총액으로 제한한다")
        void shouldCapAtTotal() {
            given(ticketPort.findByPaymentId(intentRef)).willReturn(Optional.of(paidStripe(1L)));

            service.recordProviderRefund(PaymentProviderType.STRIPE, "pi_test_1", new BigDecimal("99.00"));

            then(ticketPort).should().markRefunded(1L, new BigDecimal("35.00"), NOW);
        }

        @Test
        @DisplayName("이미 cancelled인 티켓(우리가 요청한 환불의 후속 알림)은 무시한다")
        void shouldIgnoreOwnRefundEcho() {
            given(ticketPort.findByPaymentId(intentRef)).willReturn(Optional.of(cancelled(1L)));

            service.recordProviderRefund(PaymentProviderType.STRIPE, "pi_test_1", new BigDecimal("17.50"));

            then(ticketPort).should(never()).markRefunded(anyLong(), any(), any());
        }
    }
}
