package kr.jemi.zevent.ticket.domain;

import java.math.BigDecimal;

public record PriceBreakdown(BigDecimal price, boolean includesPickup, BigDecimal pickupPrice) {

    public BigDecimal total() {
        return includesPickup ? price.add(pickupPrice) : price;
    }
}
