package kr.jemi.zevent.common.scheduler;

import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.modulith.events.EventPublication;
import org.springframework.modulith.events.IncompleteEventPublications;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 리스너가 실패해 완료 처리되지 않은 모듈 이벤트(구매 확인 메일, 고아 결제 알림)를 다시 보낸다.
 * 방금 발행된 이벤트는 아직 처리 중일 수 있으므로 olderThan보다 오래된 것만 대상으로 한다.
 */
@Component
public class EventResubmitScheduler {

    private static final Logger log = LoggerFactory.getLogger(EventResubmitScheduler.class);

    private final IncompleteEventPublications incompleteEventPublications;
    private final Clock clock;
    private final Duration olderThan;

    public EventResubmitScheduler(IncompleteEventPublications incompleteEventPublications,
                                  Clock clock,
                                  @Value("${zevent.event-resubmit.older-than}") Duration olderThan) {
        this.incompleteEventPublications = incompleteEventPublications;
        this.clock = clock;
        this.olderThan = olderThan;
    }

    @Scheduled(cron = "${zevent.event-resubmit.cron}")
    @SchedulerLock(name = "resubmitIncompleteEvents",
            lockAtMostFor = "${zevent.event-resubmit.lock-at-most-for}",
            lockAtLeastFor = "${zevent.event-resubmit.lock-at-least-for}")
    public void resubmitIncompleteEvents() {
        try {
            int count = resubmitDue();
            if (count > 0) {
                log.warn("미완료 모듈 이벤트 {}건 재발행", count);
            }
        } catch (Exception e) {
            log.error("미완료 이벤트 재발행 스케줄러 실패", e);
        }
    }

    int resubmitDue() {
        Instant threshold = clock.instant().minus(olderThan);
        AtomicInteger count = new AtomicInteger();
        incompleteEventPublications.resubmitIncompletePublications(publication -> {
            if (!publication.getPublicationDate().isBefore(threshold)) {
                return false;
            }
            log.info("이벤트 재발행 대상: id={}, event={}, listener={}",
                    publication.getIdentifier(), eventName(publication), publication.getTargetIdentifier());
            count.incrementAndGet();
            return true;
        });
        return count.get();
    }

    private static String eventName(EventPublication publication) {
        Object event = publication.getEvent();
        return event == null ? "null" : event.getClass().getSimpleName();
    }
}
