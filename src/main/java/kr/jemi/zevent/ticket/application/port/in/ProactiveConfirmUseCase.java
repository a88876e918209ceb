package kr.jemi.zevent.ticket.application.port.in;

import kr.jemi.zevent.ticket.domain.TicketStatus;

public interface ProactiveConfirmUseCase {

    TicketStatus confirmNow(long ticketId, long userId);
}
