package kr.jemi.zevent.ticket.infrastructure.out.persistence;

import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TicketJpaRepository extends JpaRepository<TicketJpaEntity, Long> {

    List<TicketJpaEntity> findByUserIdOrderByCreatedAtDesc(long userId);

    List<TicketJpaEntity> findByEventIdAndStatusIn(long eventId, Collection<TicketStatus> statuses);

    boolean existsByUserIdAndEventIdAndStatusIn(long userId, long eventId, Collection<TicketStatus> statuses);

    long countByEventIdAndStatusIn(long eventId, Collection<TicketStatus> statuses);

    Optional<TicketJpaEntity> findFirstByStripePaymentIntentId(String paymentIntentId);

    Optional<TicketJpaEntity> findFirstByPaypalCaptureId(String captureId);

    List<TicketJpaEntity> findByStatusAndCreatedAtBefore(TicketStatus status, LocalDateTime threshold);

    List<TicketJpaEntity> findByStatusAndCancelledAtLessThanEqual(TicketStatus status, LocalDateTime threshold);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update TicketJpaEntity t
               set t.paymentProvider = :provider,
                   t.stripeSessionId = :sessionId,
                   t.updatedAt = :now
             where t.id = :id and t.status = :pending and t.paymentProvider = :provider
            """)
    int attachStripeSession(@Param("id") long id,
                            @Param("provider") PaymentProviderType provider,
                            @Param("sessionId") String sessionId,
                            @Param("pending") TicketStatus pending,
                            @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update TicketJpaEntity t
               set t.paymentProvider = :provider,
                   t.paypalOrderId = :orderId,
                   t.updatedAt = :now
             where t.id = :id and t.status = :pending and t.paymentProvider = :provider
            """)
    int attachPaypalOrder(@Param("id") long id,
                          @Param("provider") PaymentProviderType provider,
                          @Param("orderId") String orderId,
                          @Param("pending") TicketStatus pending,
                          @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update TicketJpaEntity t
               set t.status = :paid,
                   t.stripeSessionId = coalesce(:checkoutId, t.stripeSessionId),
                   t.stripePaymentIntentId = coalesce(:paymentId, t.stripePaymentIntentId),
                   t.cancelledAt = null,
                   t.completedAt = :now,
                   t.updatedAt = :now
             where t.id = :id and t.status = :from and t.paymentProvider = :provider
            """)
    int markPaidWithStripe(@Param("id") long id,
                           @Param("from") TicketStatus from,
                           @Param("paid") TicketStatus paid,
                           @Param("provider") PaymentProviderType provider,
                           @Param("checkoutId") String checkoutId,
                           @Param("paymentId") String paymentId,
                           @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update TicketJpaEntity t
               set t.status = :paid,
                   t.paypalOrderId = coalesce(:checkoutId, t.paypalOrderId),
                   t.paypalCaptureId = coalesce(:paymentId, t.paypalCaptureId),
                   t.cancelledAt = null,
                   t.completedAt = :now,
                   t.updatedAt = :now
             where t.id = :id and t.status = :from and t.paymentProvider = :provider
            """)
    int markPaidWithPaypal(@Param("id") long id,
                           @Param("from") TicketStatus from,
                           @Param("paid") TicketStatus paid,
                           @Param("provider") PaymentProviderType provider,
                           @Param("checkoutId") String checkoutId,
                           @Param("paymentId") String paymentId,
                           @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update TicketJpaEntity t
               set t.status = :to,
                   t.cancelledAt = coalesce(t.cancelledAt, :now),
                   t.updatedAt = :now
             where t.id = :id and t.status = :from
            """)
    int transition(@Param("id") long id,
                   @Param("from") TicketStatus from,
                   @Param("to") TicketStatus to,
                   @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
            update TicketJpaEntity t
               set t.status = :to,
                   t.refundedAmount = :amount,
                   t.refundedAt = :now,
                   t.cancelledAt = coalesce(t.cancelledAt, :now),
                   t.updatedAt = :now
             where t.id = :id and t.status = :from and t.totalAmount >= :amount
            """)
    int transitionWithRefund(@Param("id") long id,
                             @Param("from") TicketStatus from,
                             @Param("to") TicketStatus to,
                             @Param("amount") BigDecimal amount,
                             @Param("now") LocalDateTime now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from TicketJpaEntity t where t.id = :id and t.status = :status")
    int deleteByIdAndStatus(@Param("id") long id, @Param("status") TicketStatus status);
}
