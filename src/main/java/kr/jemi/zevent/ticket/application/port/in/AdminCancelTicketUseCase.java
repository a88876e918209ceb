package kr.jemi.zevent.ticket.application.port.in;

import kr.jemi.zevent.ticket.domain.CancellationMode;
import kr.jemi.zevent.ticket.domain.CancellationResult;

public interface AdminCancelTicketUseCase {

    CancellationResult adminCancel(long ticketId, CancellationMode mode, String adminId);
}
