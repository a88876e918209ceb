package kr.jemi.zevent.ticket.application.service;

import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.CaptureOutcome;
import kr.jemi.zevent.ticket.domain.Ticket;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static kr.jemi.zevent.ticket.domain.TicketFixtures.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.BDDMockito.*;

@ExtendWith(MockitoExtension.class)
class ReconciliationPollerTest {

    private static final long TICKET_ID = 100L;
    private static final int MAX_ATTEMPTS = 3;
    private static final Duration INTERVAL = Duration.ofSeconds(5);

    @Mock
    private TicketPort ticketPort;

    @Mock
    private PaymentCheckService paymentCheckService;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> firstFuture;

    @Mock
    private ScheduledFuture<Object> secondFuture;

    private final List<Runnable> scheduled = new ArrayList<>();

    private ReconciliationPoller poller;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        poller = new ReconciliationPoller(ticketPort, paymentCheckService, taskScheduler, clock,
                MAX_ATTEMPTS, INTERVAL);
        given(taskScheduler.scheduleWithFixedDelay(any(Runnable.class), any(Instant.class), eq(INTERVAL)))
                .willAnswer(inv -> {
                    scheduled.add(inv.getArgument(0));
                    return scheduled.size() == 1 ? firstFuture : secondFuture;
                });
    }

    @Test
    @DisplayName("start()는 첫 실행을 interval 뒤로 예약하고 티켓별로 추적한다")
    void shouldScheduleWithInterval() {
        poller.start(pendingStripe(TICKET_ID));

        then(taskScheduler).should().scheduleWithFixedDelay(
                any(Runnable.class), eq(NOW.toInstant(ZoneOffset.UTC).plus(INTERVAL)), eq(INTERVAL));
        assertThat(poller.isRunning(TICKET_ID)).isTrue();
    }

    @Test
    @DisplayName("재조회한 티켓이 이미 paid면 결제사를 호출하지 않고 멈춘다")
    void shouldStopWhenAlreadyPaid() {
        poller.start(pendingStripe(TICKET_ID));
        given(ticketPort.findById(TICKET_ID)).willReturn(Optional.of(paidStripe(TICKET_ID)));

        scheduled.get(0).run();

        then(paymentCheckService).shouldHaveNoInteractions();
        then(firstFuture).should().cancel(false);
        assertThat(poller.isRunning(TICKET_ID)).isFalse();
    }

    @Test
    @DisplayName("캡처되면 멈춘다")
    void shouldStopWhenCaptured() {
        Ticket ticket = pendingStripe(TICKET_ID);
        poller.start(ticket);
        given(ticketPort.findById(TICKET_ID)).willReturn(Optional.of(ticket));
        given(paymentCheckService.check(ticket)).willReturn(CaptureOutcome.CAPTURED);

        scheduled.get(0).run();

        then(firstFuture).should().cancel(false);
        assertThat(poller.isRunning(TICKET_ID)).isFalse();
    }

    @Test
    @DisplayName("결제사 오류가 나도 계속하고 최대 시도 횟수에 도달하면 티켓을 그대로 두고 멈춘다")
    void shouldGiveUpAfterMaxAttempts() {
        Ticket ticket = pendingStripe(TICKET_ID);
        poller.start(ticket);
        given(ticketPort.findById(TICKET_ID)).willReturn(Optional.of(ticket));
        given(paymentCheckService.check(ticket))
                .willThrow(new IllegalStateException("boom"))
                .willReturn(CaptureOutcome.PENDING);

        Runnable task = scheduled.get(0);
        task.run();
        task.run();
        then(firstFuture).should(never()).cancel(anyBoolean());

        task.run();

        then(paymentCheckService).should(times(MAX_ATTEMPTS)).check(ticket);
        then(firstFuture).should().cancel(false);
        then(ticketPort).should(never()).cancel(anyLong(), any(), any());
        assertThat(poller.isRunning(TICKET_ID)).isFalse();
    }

    @Test
    @DisplayName("티켓 행이 삭제됐으면 스냅샷으로 결제사를 조회한다")
    void shouldCheckSnapshotWhenRowDeleted() {
        Ticket snapshot = pendingStripe(TICKET_ID);
        poller.start(snapshot);
        given(ticketPort.findById(TICKET_ID)).willReturn(Optional.empty());
        given(paymentCheckService.check(snapshot)).willReturn(CaptureOutcome.PENDING);

        scheduled.get(0).run();

        then(paymentCheckService).should().check(snapshot);
        assertThat(poller.isRunning(TICKET_ID)).isTrue();
    }

    @Test
    @DisplayName("같은 티켓으로 다시 시작하면 이전 작업을 취소한다")
    void shouldReplacePreviousTask() {
        poller.start(pendingStripe(TICKET_ID));
        poller.start(pendingStripe(TICKET_ID));

        then(firstFuture).should().cancel(false);
        assertThat(poller.isRunning(TICKET_ID)).isTrue();

        poller.stop(TICKET_ID);

        then(secondFuture).should().cancel(false);
        assertThat(poller.isRunning(TICKET_ID)).isFalse();
    }
}
