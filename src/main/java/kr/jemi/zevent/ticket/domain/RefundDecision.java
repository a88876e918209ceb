package kr.jemi.zevent.ticket.domain;

import java.math.BigDecimal;

public record RefundDecision(boolean eligible, BigDecimal amount) {

    public static RefundDecision notEligible() {
        return new RefundDecision(false, Money.of(BigDecimal.ZERO));
    }
}
