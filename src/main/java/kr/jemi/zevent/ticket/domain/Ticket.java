package kr.jemi.zevent.ticket.domain;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import kr.jemi.zevent.common.validation.SelfValidating;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

public class Ticket implements SelfValidating {

    private final long id;
    @Positive
    private final long userId;
    @Positive
    private final long eventId;
    @NotNull
    @DecimalMin("0.00")
    private final BigDecimal price;
    private final boolean includesPickup;
    @NotNull
    @DecimalMin("0.00")
    private final BigDecimal pickupPrice;
    private final String pickupAddress;
    private final BigDecimal totalAmount;
    @NotNull
    private final TicketStatus status;
    private final PaymentProviderType paymentProvider;
    private final String stripeSessionId;
    private final String stripePaymentIntentId;
    private final String paypalOrderId;
    private final String paypalCaptureId;
    private final BigDecimal refundedAmount;
    private final LocalDateTime refundedAt;
    @NotNull
    private final LocalDateTime createdAt;
    private final LocalDateTime cancelledAt;
    private final LocalDateTime completedAt;
    @NotNull
    private final LocalDateTime updatedAt;

    public Ticket(long id, long userId, long eventId,
                  BigDecimal price, boolean includesPickup, BigDecimal pickupPrice, String pickupAddress,
                  TicketStatus status, PaymentProviderType paymentProvider,
                  String stripeSessionId, String stripePaymentIntentId,
                  String paypalOrderId, String paypalCaptureId,
                  BigDecimal refundedAmount, LocalDateTime refundedAt,
                  LocalDateTime createdAt, LocalDateTime cancelledAt,
                  LocalDateTime completedAt, LocalDateTime updatedAt) {
        this.id = id;
        this.userId = userId;
        this.eventId = eventId;
        this.price = Money.of(price);
        this.includesPickup = includesPickup;
        this.pickupPrice = Money.of(pickupPrice);
        this.pickupAddress = pickupAddress;
        // 총액은 외부에서 받지 않는다
        this.totalAmount = new PriceBreakdown(this.price, includesPickup, this.pickupPrice).total();
        this.status = status;
        this.paymentProvider = paymentProvider;
        this.stripeSessionId = stripeSessionId;
        this.stripePaymentIntentId = stripePaymentIntentId;
        this.paypalOrderId = paypalOrderId;
        this.paypalCaptureId = paypalCaptureId;
        this.refundedAmount = refundedAmount == null ? null : Money.of(refundedAmount);
        this.refundedAt = refundedAt;
        this.createdAt = createdAt;
        this.cancelledAt = cancelledAt;
        this.completedAt = completedAt;
        this.updatedAt = updatedAt;
        validateSelf();
        validateInvariants();
    }

    public static Ticket create(long id, long userId, long eventId, PriceBreakdown breakdown,
                                String pickupAddress, PaymentProviderType provider, LocalDateTime now) {
        if (breakdown.includesPickup() && (pickupAddress == null || pickupAddress.isBlank())) {
            throw new IllegalArgumentException("픽업 서비스에는 픽업 주소가 필요합니다");
        }
        return new Ticket(id, userId, eventId,
                breakdown.price(), breakdown.includesPickup(), breakdown.pickupPrice(),
                breakdown.includesPickup() ? pickupAddress : null,
                TicketStatus.PENDING, provider,
                null, null, null, null,
                null, null,
                now, null, null, now);
    }

    private void validateInvariants() {
        if (refundedAmount != null && refundedAmount.compareTo(totalAmount) > 0) {
            throw new IllegalArgumentException(
                    "환불 금액이 총액을 초과합니다: refunded=" + refundedAmount + ", total=" + totalAmount);
        }
        boolean hasStripeIds = stripeSessionId != null || stripePaymentIntentId != null;
        boolean hasPaypalIds = paypalOrderId != null || paypalCaptureId != null;
        if (hasStripeIds && hasPaypalIds) {
            throw new IllegalArgumentException("두 결제사의 ID가 동시에 존재할 수 없습니다: ticketId=" + id);
        }
        if (paymentProvider == PaymentProviderType.STRIPE && hasPaypalIds
                || paymentProvider == PaymentProviderType.PAYPAL && hasStripeIds) {
            throw new IllegalArgumentException("결제사와 ID 그룹이 일치하지 않습니다: ticketId=" + id);
        }
    }

    public boolean isOwnedBy(long userId) {
        return this.userId == userId;
    }

    /**
     * 결제사 세션/주문이 발급되어 결제가 진행 중일 수 있는지.
     */
    public boolean isCheckoutInFlight() {
        return paymentReference()
                .map(PaymentReference::hasCheckout)
                .orElse(false);
    }

    public Optional<PaymentReference> paymentReference() {
        if (paymentProvider == null) {
            return Optional.empty();
        }
        return Optional.of(switch (paymentProvider) {
            case STRIPE -> new PaymentReference(paymentProvider, stripeSessionId, stripePaymentIntentId);
            case PAYPAL -> new PaymentReference(paymentProvider, paypalOrderId, paypalCaptureId);
        });
    }

    public boolean isPaidWith(PaymentProviderType provider) {
        return paymentProvider == null || paymentProvider == provider;
    }

    public long getId() {
        return id;
    }

    public long getUserId() {
        return userId;
    }

    public long getEventId() {
        return eventId;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public boolean isIncludesPickup() {
        return includesPickup;
    }

    public BigDecimal getPickupPrice() {
        return pickupPrice;
    }

    public String getPickupAddress() {
        return pickupAddress;
    }

    public BigDecimal getTotalAmount() {
        return totalAmount;
    }

    public TicketStatus getStatus() {
        return status;
    }

    public PaymentProviderType getPaymentProvider() {
        return paymentProvider;
    }

    public String getStripeSessionId() {
        return stripeSessionId;
    }

    public String getStripePaymentIntentId() {
        return stripePaymentIntentId;
    }

    public String getPaypalOrderId() {
        return paypalOrderId;
    }

    public String getPaypalCaptureId() {
        return paypalCaptureId;
    }

    public BigDecimal getRefundedAmount() {
        return refundedAmount;
    }

    public LocalDateTime getRefundedAt() {
        return refundedAt;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getCancelledAt() {
        return cancelledAt;
    }

    public LocalDateTime getCompletedAt() {
        return completedAt;
    }

    public LocalDateTime getUpdatedAt() {
        return updatedAt;
    }
}
