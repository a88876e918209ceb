package kr.jemi.zevent.ticket.domain;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

public enum TicketStatus {

    PENDING("pending"),
    PENDING_CANCELLATION("pending_cancellation"),
    PAID("paid"),
    CANCELLED("cancelled"),
    REFUNDED("refunded");

    /**
     * 좌석을 점유하는 상태. (사용자, 이벤트)당 하나만 존재할 수 있다.
     */
    public static final Set<TicketStatus> ACTIVE = EnumSet.of(PENDING, PENDING_CANCELLATION, PAID);

    private final String value;

    TicketStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return this == CANCELLED || this == REFUNDED;
    }

    public boolean canTransitionTo(TicketStatus target) {
        return switch (this) {
            case PENDING -> target == PAID || target == PENDING_CANCELLATION || target == CANCELLED;
            case PENDING_CANCELLATION -> target == PAID || target == CANCELLED;
            case PAID -> target == CANCELLED || target == REFUNDED;
            case CANCELLED, REFUNDED -> false;
        };
    }

    public static TicketStatus from(String value) {
        return Arrays.stream(values())
                .filter(s -> s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("알 수 없는 티켓 상태: " + value));
    }
}
