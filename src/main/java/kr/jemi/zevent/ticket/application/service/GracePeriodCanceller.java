package kr.jemi.zevent.ticket.application.service;

import kr.jemi.zevent.ticket.application.port.in.FinalizeCancellationsUseCase;
import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.Ticket;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * PENDING_CANCELLATION 티켓을 유예 기간이 끝나면 CANCELLED로 확정한다.
 * 티켓별 타이머가 기본 경로이고, 재시작으로 타이머를 잃은 티켓은 주기 작업이 정리한다.
 */
@Component
public class GracePeriodCanceller implements FinalizeCancellationsUseCase {

    private static final Logger log = LoggerFactory.getLogger(GracePeriodCanceller.class);

    private final TicketPort ticketPort;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration gracePeriod;

    private final Map<Long, CancellationTimer> timers = new ConcurrentHashMap<>();

    public GracePeriodCanceller(TicketPort ticketPort,
                                TaskScheduler taskScheduler,
                                Clock clock,
                                @Value("${zevent.ticket.grace-period}") Duration gracePeriod) {
        this.ticketPort = ticketPort;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.gracePeriod = gracePeriod;
    }

    public boolean isEnabled() {
        return !gracePeriod.isZero() && !gracePeriod.isNegative();
    }

    public LocalDateTime deadlineFrom(LocalDateTime cancelledAt) {
        return cancelledAt.plus(gracePeriod);
    }

    public void schedule(long ticketId, LocalDateTime deadline) {
        // 즉시 실행되는 작업도 자기 항목만 지우도록 먼저 등록한다
        CancellationTimer timer = new CancellationTimer();
        CancellationTimer previous = timers.put(ticketId, timer);
        if (previous != null) {
            previous.cancel();
        }
        timer.attach(taskScheduler.schedule(
                () -> fire(ticketId, timer),
                deadline.toInstant(ZoneOffset.UTC)));
        log.info("취소 유예 시작: ticketId={}, deadline={}", ticketId, deadline);
    }

    public void cancelTimer(long ticketId) {
        CancellationTimer timer = timers.remove(ticketId);
        if (timer != null) {
            timer.cancel();
        }
    }

    public boolean finalizeCancellation(long ticketId) {
        cancelTimer(ticketId);
        return transition(ticketId);
    }

    int scheduledCount() {
        return timers.size();
    }

    private void fire(long ticketId, CancellationTimer timer) {
        timers.remove(ticketId, timer);
        if (timer.isCancelled()) {
            return;
        }
        transition(ticketId);
    }

    private boolean transition(long ticketId) {
        try {
            boolean cancelled = ticketPort.cancel(ticketId, TicketStatus.PENDING_CANCELLATION, LocalDateTime.now(clock));
            if (cancelled) {
                log.info("취소 유예 종료, 티켓 취소 확정: ticketId={}", ticketId);
            } else {
                log.debug("취소 확정 생략, 이미 다른 상태로 전이됨: ticketId={}", ticketId);
            }
            return cancelled;
        } catch (Exception e) {
            // 주기 작업이 다시 시도한다
            log.error("취소 확정 실패: ticketId={}", ticketId, e);
            return false;
        }
    }

    @Override
    public int finalizeExpiredCancellations() {
        LocalDateTime threshold = LocalDateTime.now(clock).minus(gracePeriod);
        List<Ticket> expired = ticketPort.findCancellationsRequestedBefore(threshold);
        int count = 0;
        for (Ticket ticket : expired) {
            if (finalizeCancellation(ticket.getId())) {
                count++;
            }
        }
        if (count > 0) {
            log.info("유예 기간 만료 티켓 취소 확정 {}건", count);
        }
        return count;
    }

    /** schedule() 반환 전에 취소될 수 있으므로 future 연결 후 취소 여부를 다시 본다. */
    private static final class CancellationTimer {

        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> future;

        void attach(ScheduledFuture<?> scheduled) {
            this.future = scheduled;
            if (cancelled) {
                scheduled.cancel(false);
            }
        }

        void cancel() {
            cancelled = true;
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }

        boolean isCancelled() {
            return cancelled;
        }
    }
}
