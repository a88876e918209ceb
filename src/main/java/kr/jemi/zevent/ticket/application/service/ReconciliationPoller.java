package kr.jemi.zevent.ticket.application.service;

import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.CaptureOutcome;
import kr.jemi.zevent.ticket.domain.Ticket;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * 웹훅이 오지 않는 경우를 대비해 결제 세션마다 결제사를 주기적으로 조회한다.
 * 같은 티켓에 다시 시작하면 이전 작업을 대체한다.
 */
@Component
public class ReconciliationPoller {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationPoller.class);

    private final TicketPort ticketPort;
    private final PaymentCheckService paymentCheckService;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final int maxAttempts;
    private final Duration interval;

    private final Map<Long, ScheduledFuture<?>> tasks = new ConcurrentHashMap<>();

    public ReconciliationPoller(TicketPort ticketPort,
                                PaymentCheckService paymentCheckService,
                                TaskScheduler taskScheduler,
                                Clock clock,
                                @Value("${zevent.reconciliation.max-attempts}") int maxAttempts,
                                @Value("${zevent.reconciliation.interval}") Duration interval) {
        this.ticketPort = ticketPort;
        this.paymentCheckService = paymentCheckService;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.interval = interval;
    }

    /**
     * @param snapshot 결제 세션이 연결된 티켓. 행이 삭제돼도 이 스냅샷으로 결제사를 조회한다
     */
    public void start(Ticket snapshot) {
        long ticketId = snapshot.getId();
        PollTask task = new PollTask(snapshot);
        synchronized (task) {
            task.future = taskScheduler.scheduleWithFixedDelay(task, clock.instant().plus(interval), interval);
        }
        ScheduledFuture<?> previous = tasks.put(ticketId, task.future);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("결제 확인 폴러 시작: ticketId={}, maxAttempts={}, interval={}", ticketId, maxAttempts, interval);
    }

    public void stop(long ticketId) {
        ScheduledFuture<?> future = tasks.remove(ticketId);
        if (future != null) {
            future.cancel(false);
        }
    }

    public boolean isRunning(long ticketId) {
        return tasks.containsKey(ticketId);
    }

    private class PollTask implements Runnable {

        private final Ticket snapshot;
        private ScheduledFuture<?> future;
        private int attempts;

        PollTask(Ticket snapshot) {
            this.snapshot = snapshot;
        }

        @Override
        public void run() {
            long ticketId = snapshot.getId();
            attempts++;
            try {
                Optional<Ticket> current = ticketPort.findById(ticketId);
                if (current.isPresent() && isSettled(current.get().getStatus())) {
                    finish("이미 처리됨");
                    return;
                }
                CaptureOutcome outcome = paymentCheckService.check(current.orElse(snapshot));
                if (outcome.isTerminal()) {
                    finish(outcome.name());
                    return;
                }
            } catch (Exception e) {
                log.warn("결제 확인 폴링 실패: ticketId={}, attempt={}/{}", ticketId, attempts, maxAttempts, e);
            }
            if (attempts >= maxAttempts) {
                log.info("결제 확인 폴링 종료(시도 소진), 티켓 상태 유지: ticketId={}", ticketId);
                finish("시도 소진");
            }
        }

        private boolean isSettled(TicketStatus status) {
            return status == TicketStatus.PAID || status == TicketStatus.REFUNDED;
        }

        private void finish(String reason) {
            ScheduledFuture<?> self;
            synchronized (this) {
                self = future;
            }
            if (self != null) {
                tasks.remove(snapshot.getId(), self);
                self.cancel(false);
            }
            log.debug("결제 확인 폴러 종료: ticketId={}, attempts={}, reason={}", snapshot.getId(), attempts, reason);
        }
    }
}
