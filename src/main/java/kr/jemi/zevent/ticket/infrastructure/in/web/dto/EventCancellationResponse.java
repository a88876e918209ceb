package kr.jemi.zevent.ticket.infrastructure.in.web.dto;

import kr.jemi.zevent.ticket.application.port.in.CancelEventTicketsUseCase.EventCancellationReport;

import java.util.List;

public record EventCancellationResponse(long eventId,
                                        int cancelled,
                                        int refunded,
                                        List<FailureResponse> failures) {

    public record FailureResponse(long ticketId, String reason) {
    }

    public static EventCancellationResponse from(EventCancellationReport report) {
        return new EventCancellationResponse(
                report.eventId(),
                report.cancelled(),
                report.refunded(),
                report.failures().stream()
                        .map(f -> new FailureResponse(f.ticketId(), f.reason()))
                        .toList()
        );
    }
}
