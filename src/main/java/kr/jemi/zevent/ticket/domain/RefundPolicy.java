package kr.jemi.zevent.ticket.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 이벤트 시작까지 남은 일수가 noticeDays 이상이면 결제 금액의 percent%를 환불한다.
 * 남은 일수는 소수점 이하를 버린다.
 */
public class RefundPolicy {

    private final boolean enabled;
    private final int noticeDays;
    private final int percent;

    public RefundPolicy(boolean enabled, int noticeDays, int percent) {
        if (noticeDays < 0) {
            throw new IllegalArgumentException("noticeDays는 0 이상이어야 합니다: " + noticeDays);
        }
        if (percent < 0 || percent > 100) {
            throw new IllegalArgumentException("percent는 0~100 사이여야 합니다: " + percent);
        }
        this.enabled = enabled;
        this.noticeDays = noticeDays;
        this.percent = percent;
    }

    public static RefundPolicy disabled() {
        return new RefundPolicy(false, 0, 0);
    }

    public RefundDecision evaluate(Ticket ticket, LocalDateTime now, LocalDateTime eventStartsAt) {
        if (!enabled || ticket.getStatus() != TicketStatus.PAID) {
            return RefundDecision.notEligible();
        }
        long daysUntilEvent = Duration.between(now, eventStartsAt).toDays();
        if (daysUntilEvent < noticeDays) {
            return RefundDecision.notEligible();
        }
        return new RefundDecision(true, partialAmount(ticket.getTotalAmount()));
    }

    public BigDecimal partialAmount(BigDecimal total) {
        return total.multiply(BigDecimal.valueOf(percent))
                .divide(BigDecimal.valueOf(100), Money.SCALE, RoundingMode.HALF_UP);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public int getNoticeDays() {
        return noticeDays;
    }

    public int getPercent() {
        return percent;
    }
}
