package kr.jemi.zevent.ticket.infrastructure.in.web.dto;

import kr.jemi.zevent.ticket.domain.CancellationResult;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record CancellationResponse(long ticketId,
                                   String outcome,
                                   BigDecimal refundedAmount,
                                   LocalDateTime finalizesAt) {

    public static CancellationResponse from(CancellationResult result) {
        return new CancellationResponse(
                result.ticketId(),
                result.outcome().name().toLowerCase(),
                result.refundedAmount(),
                result.finalizesAt()
        );
    }
}
