package kr.jemi.zevent.ticket.domain;

import java.math.BigDecimal;
import java.util.Objects;

public class PricingPolicy {

    private final BigDecimal pickupPrice;

    public PricingPolicy(BigDecimal pickupPrice) {
        Objects.requireNonNull(pickupPrice, "pickupPrice");
        if (pickupPrice.signum() < 0) {
            throw new IllegalArgumentException("픽업 가격은 음수일 수 없습니다: " + pickupPrice);
        }
        this.pickupPrice = Money.of(pickupPrice);
    }

    public boolean isAllowed(EventInfo event, BuyerGroup group) {
        return event.isOpenTo(group);
    }

    public PriceBreakdown price(EventInfo event, BuyerGroup group, boolean includesPickup) {
        BigDecimal base = Money.of(event.priceFor(group));
        BigDecimal pickup = includesPickup ? pickupPrice : Money.of(BigDecimal.ZERO);
        return new PriceBreakdown(base, includesPickup, pickup);
    }

    public BigDecimal getPickupPrice() {
        return pickupPrice;
    }
}
