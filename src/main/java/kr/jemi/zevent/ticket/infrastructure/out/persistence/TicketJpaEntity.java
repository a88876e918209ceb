package kr.jemi.zevent.ticket.infrastructure.out.persistence;

import jakarta.persistence.*;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.Ticket;
import kr.jemi.zevent.ticket.domain.TicketStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "tickets", indexes = {
        @Index(name = "idx_ticket_user_event", columnList = "userId, eventId"),
        @Index(name = "idx_ticket_event_status", columnList = "eventId, status"),
        @Index(name = "idx_ticket_status_created", columnList = "status, createdAt"),
        @Index(name = "idx_ticket_stripe_payment_intent", columnList = "stripePaymentIntentId"),
        @Index(name = "idx_ticket_paypal_capture", columnList = "paypalCaptureId")
})
public class TicketJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private long userId;

    @Column(nullable = false)
    private long eventId;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(nullable = false)
    private boolean includesPickup;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal pickupPrice;

    private String pickupAddress;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private TicketStatus status;

    @Enumerated(EnumType.STRING)
    @Column(length = 16)
    private PaymentProviderType paymentProvider;

    private String stripeSessionId;
    private String stripePaymentIntentId;
    private String paypalOrderId;
    private String paypalCaptureId;

    @Column(precision = 10, scale = 2)
    private BigDecimal refundedAmount;

    private LocalDateTime refundedAt;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    private LocalDateTime cancelledAt;
    private LocalDateTime completedAt;

    @Column(nullable = false)
    private LocalDateTime updatedAt;

    protected TicketJpaEntity() {}

    public static TicketJpaEntity fromDomain(Ticket ticket) {
        TicketJpaEntity entity = new TicketJpaEntity();
        entity.id = ticket.getId();
        entity.userId = ticket.getUserId();
        entity.eventId = ticket.getEventId();
        entity.price = ticket.getPrice();
        entity.includesPickup = ticket.isIncludesPickup();
        entity.pickupPrice = ticket.getPickupPrice();
        entity.pickupAddress = ticket.getPickupAddress();
        entity.totalAmount = ticket.getTotalAmount();
        entity.status = ticket.getStatus();
        entity.paymentProvider = ticket.getPaymentProvider();
        entity.stripeSessionId = ticket.getStripeSessionId();
        entity.stripePaymentIntentId = ticket.getStripePaymentIntentId();
        entity.paypalOrderId = ticket.getPaypalOrderId();
        entity.paypalCaptureId = ticket.getPaypalCaptureId();
        entity.refundedAmount = ticket.getRefundedAmount();
        entity.refundedAt = ticket.getRefundedAt();
        entity.createdAt = ticket.getCreatedAt();
        entity.cancelledAt = ticket.getCancelledAt();
        entity.completedAt = ticket.getCompletedAt();
        entity.updatedAt = ticket.getUpdatedAt();
        return entity;
    }

    // totalAmount 컬럼은 조회용이며 도메인에서 다시 계산한다
    public Ticket toDomain() {
        return new Ticket(id, userId, eventId,
                price, includesPickup, pickupPrice, pickupAddress,
                status, paymentProvider,
                stripeSessionId, stripePaymentIntentId,
                paypalOrderId, paypalCaptureId,
                refundedAmount, refundedAt,
                createdAt, cancelledAt, completedAt, updatedAt);
    }

    public Long getId() { return id; }
    public TicketStatus getStatus() { return status; }
    public BigDecimal getTotalAmount() { return totalAmount; }
}
