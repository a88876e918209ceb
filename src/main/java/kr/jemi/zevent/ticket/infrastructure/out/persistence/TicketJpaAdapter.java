package kr.jemi.zevent.ticket.infrastructure.out.persistence;

import kr.jemi.zevent.ticket.application.port.out.TicketPort;
import kr.jemi.zevent.ticket.domain.PaymentReference;
import kr.jemi.zevent.ticket.domain.Ticket;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Component
@Transactional(readOnly = true)
public class TicketJpaAdapter implements TicketPort {

    private final TicketJpaRepository repository;

    public TicketJpaAdapter(TicketJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    @Transactional
    public Ticket insert(Ticket ticket) {
        return repository.save(TicketJpaEntity.fromDomain(ticket)).toDomain();
    }

    @Override
    public Optional<Ticket> findById(long ticketId) {
        return repository.findById(ticketId).map(TicketJpaEntity::toDomain);
    }

    @Override
    public List<Ticket> findByUserId(long userId) {
        return toDomain(repository.findByUserIdOrderByCreatedAtDesc(userId));
    }

    @Override
    public List<Ticket> findActiveByEventId(long eventId) {
        return toDomain(repository.findByEventIdAndStatusIn(eventId, TicketStatus.ACTIVE));
    }

    @Override
    public Optional<Ticket> findByPaymentId(PaymentReference reference) {
        if (!reference.hasPayment()) {
            return Optional.empty();
        }
        Optional<TicketJpaEntity> entity = switch (reference.provider()) {
            case STRIPE -> repository.findFirstByStripePaymentIntentId(reference.paymentId());
            case PAYPAL -> repository.findFirstByPaypalCaptureId(reference.paymentId());
        };
        return entity.map(TicketJpaEntity::toDomain);
    }

    @Override
    public boolean existsActive(long userId, long eventId) {
        return repository.existsByUserIdAndEventIdAndStatusIn(userId, eventId, TicketStatus.ACTIVE);
    }

    @Override
    public long countActiveForEvent(long eventId) {
        return repository.countByEventIdAndStatusIn(eventId, TicketStatus.ACTIVE);
    }

    @Override
    @Transactional
    public boolean attachCheckout(long ticketId, PaymentReference reference, LocalDateTime now) {
        int updated = switch (reference.provider()) {
            case STRIPE -> repository.attachStripeSession(
                    ticketId, reference.provider(), reference.checkoutId(), TicketStatus.PENDING, now);
            case PAYPAL -> repository.attachPaypalOrder(
                    ticketId, reference.provider(), reference.checkoutId(), TicketStatus.PENDING, now);
        };
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean markPaid(long ticketId, TicketStatus from, PaymentReference reference, LocalDateTime now) {
        int updated = switch (reference.provider()) {
            case STRIPE -> repository.markPaidWithStripe(ticketId, from, TicketStatus.PAID,
                    reference.provider(), reference.checkoutId(), reference.paymentId(), now);
            case PAYPAL -> repository.markPaidWithPaypal(ticketId, from, TicketStatus.PAID,
                    reference.provider(), reference.checkoutId(), reference.paymentId(), now);
        };
        return updated == 1;
    }

    @Override
    @Transactional
    public boolean requestCancellation(long ticketId, LocalDateTime now) {
        return repository.transition(ticketId, TicketStatus.PENDING, TicketStatus.PENDING_CANCELLATION, now) == 1;
    }

    @Override
    @Transactional
    public boolean cancel(long ticketId, TicketStatus from, LocalDateTime now) {
        if (!from.canTransitionTo(TicketStatus.CANCELLED)) {
            return false;
        }
        return repository.transition(ticketId, from, TicketStatus.CANCELLED, now) == 1;
    }

    @Override
    @Transactional
    public boolean cancelWithRefund(long ticketId, BigDecimal refundedAmount, LocalDateTime now) {
        return repository.transitionWithRefund(
                ticketId, TicketStatus.PAID, TicketStatus.CANCELLED, refundedAmount, now) == 1;
    }

    @Override
    @Transactional
    public boolean markRefunded(long ticketId, BigDecimal refundedAmount, LocalDateTime now) {
        return repository.transitionWithRefund(
                ticketId, TicketStatus.PAID, TicketStatus.REFUNDED, refundedAmount, now) == 1;
    }

    @Override
    @Transactional
    public boolean deletePending(long ticketId) {
        return repository.deleteByIdAndStatus(ticketId, TicketStatus.PENDING) == 1;
    }

    @Override
    public List<Ticket> findCancellationsRequestedBefore(LocalDateTime threshold) {
        return toDomain(repository.findByStatusAndCancelledAtLessThanEqual(TicketStatus.PENDING_CANCELLATION, threshold));
    }

    @Override
    public List<Ticket> findPendingCreatedBefore(LocalDateTime threshold) {
        return toDomain(repository.findByStatusAndCreatedAtBefore(TicketStatus.PENDING, threshold));
    }

    private List<Ticket> toDomain(List<TicketJpaEntity> entities) {
        return entities.stream()
                .map(TicketJpaEntity::toDomain)
                .toList();
    }
}
