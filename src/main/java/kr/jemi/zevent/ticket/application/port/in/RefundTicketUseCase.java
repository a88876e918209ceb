package kr.jemi.zevent.ticket.application.port.in;

import kr.jemi.zevent.ticket.domain.CancellationResult;

public interface RefundTicketUseCase {

    CancellationResult refund(long ticketId, boolean full, String adminId);
}
