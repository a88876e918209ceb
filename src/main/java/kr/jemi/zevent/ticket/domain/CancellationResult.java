package kr.jemi.zevent.ticket.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record CancellationResult(long ticketId,
                                 Outcome outcome,
                                 BigDecimal refundedAmount,
                                 LocalDateTime finalizesAt) {

    public enum Outcome {
        DELETED,
        GRACE_PERIOD,
        CANCELLED,
        REFUNDED
    }

    public static CancellationResult deleted(long ticketId) {
        return new CancellationResult(ticketId, Outcome.DELETED, null, null);
    }

    public static CancellationResult gracePeriod(long ticketId, LocalDateTime finalizesAt) {
        return new CancellationResult(ticketId, Outcome.GRACE_PERIOD, null, finalizesAt);
    }

    public static CancellationResult cancelled(long ticketId, BigDecimal refundedAmount) {
        return new CancellationResult(ticketId, Outcome.CANCELLED, refundedAmount, null);
    }

    public static CancellationResult refunded(long ticketId, BigDecimal refundedAmount) {
        return new CancellationResult(ticketId, Outcome.REFUNDED, refundedAmount, null);
    }
}
