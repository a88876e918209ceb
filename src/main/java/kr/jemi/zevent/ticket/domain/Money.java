package kr.jemi.zevent.ticket.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Money {

    public static final String CURRENCY = "EUR";
    public static final int SCALE = 2;

    private Money() {}

    public static BigDecimal of(BigDecimal amount) {
        return amount == null ? BigDecimal.ZERO.setScale(SCALE) : amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal of(String amount) {
        return of(new BigDecimal(amount));
    }

    public static long toMinorUnits(BigDecimal amount) {
        return of(amount).movePointRight(SCALE).longValueExact();
    }

    public static BigDecimal fromMinorUnits(long minor) {
        return BigDecimal.valueOf(minor, SCALE);
    }
}
