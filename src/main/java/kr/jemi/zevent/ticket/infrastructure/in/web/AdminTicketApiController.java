package kr.jemi.zevent.ticket.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import kr.jemi.zevent.ticket.application.port.in.AdminCancelTicketUseCase;
import kr.jemi.zevent.ticket.application.port.in.CancelEventTicketsUseCase;
import kr.jemi.zevent.ticket.application.port.in.RefundTicketUseCase;
import kr.jemi.zevent.ticket.domain.CancellationMode;
import kr.jemi.zevent.ticket.infrastructure.in.web.dto.CancellationResponse;
import kr.jemi.zevent.ticket.infrastructure.in.web.dto.EventCancellationResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 운영자 전용. 호출 횟수 제한은 AdminRateLimitInterceptor가 건다.
 */
@Tag(name = "Admin", description = "운영자 티켓 취소와 환불")
@RestController
public class AdminTicketApiController {

    private final AdminCancelTicketUseCase adminCancelTicketUseCase;
    private final RefundTicketUseCase refundTicketUseCase;
    private final CancelEventTicketsUseCase cancelEventTicketsUseCase;

    public AdminTicketApiController(AdminCancelTicketUseCase adminCancelTicketUseCase,
                                    RefundTicketUseCase refundTicketUseCase,
                                    CancelEventTicketsUseCase cancelEventTicketsUseCase) {
        this.adminCancelTicketUseCase = adminCancelTicketUseCase;
        this.refundTicketUseCase = refundTicketUseCase;
        this.cancelEventTicketsUseCase = cancelEventTicketsUseCase;
    }

    @Operation(summary = "티켓 취소", description = "mode: auto, refund, no_refund")
    @PostMapping("/admin/tickets/{ticketId}/cancel")
    public ResponseEntity<CancellationResponse> cancel(
            @Parameter(description = "운영자 ID") @RequestHeader("X-Admin-Id") String adminId,
            @PathVariable long ticketId,
            @RequestParam(defaultValue = "auto") String mode) {
        return ResponseEntity.ok(CancellationResponse.from(
                adminCancelTicketUseCase.adminCancel(ticketId, cancellationMode(mode), adminId)));
    }

    @Operation(summary = "티켓 환불", description = "full=false면 환불 정책의 비율만큼 부분 환불합니다.")
    @PostMapping("/admin/tickets/{ticketId}/refund")
    public ResponseEntity<CancellationResponse> refund(@RequestHeader("X-Admin-Id") String adminId,
                                                       @PathVariable long ticketId,
                                                       @RequestParam(defaultValue = "true") boolean full) {
        return ResponseEntity.ok(CancellationResponse.from(refundTicketUseCase.refund(ticketId, full, adminId)));
    }

    @Operation(summary = "이벤트 전체 티켓 취소", description = "이벤트의 활성 티켓을 모두 취소하고 실패 목록을 반환합니다.")
    @PostMapping("/admin/events/{eventId}/cancel-tickets")
    public ResponseEntity<EventCancellationResponse> cancelEventTickets(
            @RequestHeader("X-Admin-Id") String adminId,
            @PathVariable long eventId,
            @RequestParam(defaultValue = "true") boolean refund) {
        return ResponseEntity.ok(EventCancellationResponse.from(
                cancelEventTicketsUseCase.cancelEventTickets(eventId, refund, adminId)));
    }

    private CancellationMode cancellationMode(String mode) {
        try {
            return CancellationMode.from(mode);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_REQUEST, "알 수 없는 취소 모드: " + mode);
        }
    }
}
