package kr.jemi.zevent.ticket.application.port.in;

import java.util.List;

public interface CancelEventTicketsUseCase {

    EventCancellationReport cancelEventTickets(long eventId, boolean refund, String adminId);

    record EventCancellationReport(long eventId,
                                   int cancelled,
                                   int refunded,
                                   List<Failure> failures) {

        public record Failure(long ticketId, String reason) {
        }
    }
}
