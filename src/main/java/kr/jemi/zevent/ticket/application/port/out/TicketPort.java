package kr.jemi.zevent.ticket.application.port.out;

import kr.jemi.zevent.ticket.domain.PaymentReference;
import kr.jemi.zevent.ticket.domain.Ticket;
import kr.jemi.zevent.ticket.domain.TicketStatus;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 상태 전이는 모두 "WHERE id=? AND status=?" 조건부 갱신이다.
 * 반환값 false는 경쟁에서 진 쪽이며 호출자는 no-op으로 처리한다.
 */
public interface TicketPort {

    Ticket insert(Ticket ticket);

    Optional<Ticket> findById(long ticketId);

    List<Ticket> findByUserId(long userId);

    List<Ticket> findActiveByEventId(long eventId);

    Optional<Ticket> findByPaymentId(PaymentReference reference);

    boolean existsActive(long userId, long eventId);

    long countActiveForEvent(long eventId);

    boolean attachCheckout(long ticketId, PaymentReference reference, LocalDateTime now);

    boolean markPaid(long ticketId, TicketStatus from, PaymentReference reference, LocalDateTime now);

    boolean requestCancellation(long ticketId, LocalDateTime now);

    boolean cancel(long ticketId, TicketStatus from, LocalDateTime now);

    boolean cancelWithRefund(long ticketId, BigDecimal refundedAmount, LocalDateTime now);

    boolean markRefunded(long ticketId, BigDecimal refundedAmount, LocalDateTime now);

    boolean deletePending(long ticketId);

    List<Ticket> findCancellationsRequestedBefore(LocalDateTime threshold);

    List<Ticket> findPendingCreatedBefore(LocalDateTime threshold);
}
