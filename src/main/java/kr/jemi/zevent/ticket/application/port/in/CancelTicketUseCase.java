package kr.jemi.zevent.ticket.application.port.in;

import kr.jemi.zevent.ticket.domain.CancellationMode;
import kr.jemi.zevent.ticket.domain.CancellationResult;

public interface CancelTicketUseCase {

    CancellationResult cancel(long ticketId, long userId, CancellationMode mode);
}
