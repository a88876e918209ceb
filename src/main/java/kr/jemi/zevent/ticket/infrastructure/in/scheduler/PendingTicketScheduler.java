package kr.jemi.zevent.ticket.infrastructure.in.scheduler;

import kr.jemi.zevent.ticket.application.port.in.FinalizeCancellationsUseCase;
import kr.jemi.zevent.ticket.application.port.in.SweepStalePendingUseCase;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class PendingTicketScheduler {

    private static final Logger log = LoggerFactory.getLogger(PendingTicketScheduler.class);

    private final FinalizeCancellationsUseCase finalizeCancellationsUseCase;
    private final SweepStalePendingUseCase sweepStalePendingUseCase;

    public PendingTicketScheduler(FinalizeCancellationsUseCase finalizeCancellationsUseCase,
                                  SweepStalePendingUseCase sweepStalePendingUseCase) {
        this.finalizeCancellationsUseCase = finalizeCancellationsUseCase;
        this.sweepStalePendingUseCase = sweepStalePendingUseCase;
    }

    // 재시작으로 사라진 유예 타이머를 보완한다
    @Scheduled(cron = "${zevent.grace-finalizer.cron}")
    @SchedulerLock(name = "finalizeExpiredCancellations",
            lockAtMostFor = "${zevent.grace-finalizer.lock-at-most-for}",
            lockAtLeastFor = "${zevent.grace-finalizer.lock-at-least-for}")
    public void finalizeCancellations() {
        try {
            int finalized = finalizeCancellationsUseCase.finalizeExpiredCancellations();
            if (finalized > 0) {
                log.info("유예 기간 만료 티켓 취소 확정: {}건", finalized);
            }
        } catch (Exception e) {
            log.error("유예 취소 확정 스케줄러 실패", e);
        }
    }

    @Scheduled(cron = "${zevent.stale-pending.cron}")
    @SchedulerLock(name = "sweepStalePendingTickets",
            lockAtMostFor = "${zevent.stale-pending.lock-at-most-for}",
            lockAtLeastFor = "${zevent.stale-pending.lock-at-least-for}")
    public void sweepStalePending() {
        try {
            int swept = sweepStalePendingUseCase.sweepStalePending();
            if (swept > 0) {
                log.info("오래된 pending 티켓 정리: {}건", swept);
            }
        } catch (Exception e) {
            log.error("pending 티켓 정리 스케줄러 실패", e);
        }
    }
}
