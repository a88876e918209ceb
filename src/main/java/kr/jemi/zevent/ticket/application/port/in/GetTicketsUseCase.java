package kr.jemi.zevent.ticket.application.port.in;

import kr.jemi.zevent.ticket.domain.Ticket;

import java.util.List;

public interface GetTicketsUseCase {

    List<Ticket> getMyTickets(long userId);

    Ticket getMyTicket(long ticketId, long userId);
}
