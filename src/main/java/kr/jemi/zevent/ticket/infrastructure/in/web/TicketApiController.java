package kr.jemi.zevent.ticket.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import kr.jemi.zevent.ticket.application.port.in.CancelTicketUseCase;
import kr.jemi.zevent.ticket.application.port.in.CheckoutResult;
import kr.jemi.zevent.ticket.application.port.in.CreateTicketUseCase;
import kr.jemi.zevent.ticket.application.port.in.GetTicketsUseCase;
import kr.jemi.zevent.ticket.application.port.in.ProactiveConfirmUseCase;
import kr.jemi.zevent.ticket.application.port.in.RetryCheckoutUseCase;
import kr.jemi.zevent.ticket.domain.CancellationMode;
import kr.jemi.zevent.ticket.domain.TicketStatus;
import kr.jemi.zevent.ticket.infrastructure.in.web.dto.CancellationResponse;
import kr.jemi.zevent.ticket.infrastructure.in.web.dto.CheckoutResponse;
import kr.jemi.zevent.ticket.infrastructure.in.web.dto.CreateTicketRequest;
import kr.jemi.zevent.ticket.infrastructure.in.web.dto.PaymentStatusResponse;
import kr.jemi.zevent.ticket.infrastructure.in.web.dto.TicketResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "Ticket", description = "티켓 구매와 결제, 취소")
@RestController
public class TicketApiController {

    private final CreateTicketUseCase createTicketUseCase;
    private final RetryCheckoutUseCase retryCheckoutUseCase;
    private final GetTicketsUseCase getTicketsUseCase;
    private final ProactiveConfirmUseCase proactiveConfirmUseCase;
    private final CancelTicketUseCase cancelTicketUseCase;

    public TicketApiController(CreateTicketUseCase createTicketUseCase,
                               RetryCheckoutUseCase retryCheckoutUseCase,
                               GetTicketsUseCase getTicketsUseCase,
                               ProactiveConfirmUseCase proactiveConfirmUseCase,
                               CancelTicketUseCase cancelTicketUseCase) {
        this.createTicketUseCase = createTicketUseCase;
        this.retryCheckoutUseCase = retryCheckoutUseCase;
        this.getTicketsUseCase = getTicketsUseCase;
        this.proactiveConfirmUseCase = proactiveConfirmUseCase;
        this.cancelTicketUseCase = cancelTicketUseCase;
    }

    @Operation(summary = "티켓 구매", description = "pending 티켓을 만들고 결제사 체크아웃 URL을 반환합니다.")
    @PostMapping("/api/tickets")
    public ResponseEntity<CheckoutResponse> create(
            @Parameter(description = "구매자 ID") @RequestHeader("X-User-Id") long userId,
            @Valid @RequestBody CreateTicketRequest request) {
        CheckoutResult result = createTicketUseCase.create(request.toCommand(userId));
        return ResponseEntity.status(HttpStatus.CREATED).body(CheckoutResponse.from(result));
    }

    @Operation(summary = "내 티켓 목록")
    @GetMapping("/api/tickets")
    public ResponseEntity<List<TicketResponse>> getMyTickets(@RequestHeader("X-User-Id") long userId) {
        List<TicketResponse> tickets = getTicketsUseCase.getMyTickets(userId).stream()
                .map(TicketResponse::from)
                .toList();
        return ResponseEntity.ok(tickets);
    }

    @Operation(summary = "티켓 조회", description = "본인 티켓만 조회할 수 있습니다.")
    @GetMapping("/api/tickets/{ticketId}")
    public ResponseEntity<TicketResponse> getMyTicket(@RequestHeader("X-User-Id") long userId,
                                                      @PathVariable long ticketId) {
        return ResponseEntity.ok(TicketResponse.from(getTicketsUseCase.getMyTicket(ticketId, userId)));
    }

    @Operation(summary = "체크아웃 재시도", description = "pending 티켓에 새 체크아웃을 발급합니다.")
    @PostMapping("/api/tickets/{ticketId}/retry-checkout")
    public ResponseEntity<CheckoutResponse> retryCheckout(@RequestHeader("X-User-Id") long userId,
                                                          @PathVariable long ticketId) {
        CheckoutResult result = retryCheckoutUseCase.retryCheckout(ticketId, userId);
        return ResponseEntity.ok(CheckoutResponse.from(result));
    }

    @Operation(summary = "결제 즉시 확인", description = "결제 페이지에서 돌아온 직후 결제사 상태를 확인합니다. 미확정이면 202를 반환합니다.")
    @PostMapping("/api/tickets/{ticketId}/confirm-payment")
    public ResponseEntity<PaymentStatusResponse> confirmPayment(@RequestHeader("X-User-Id") long userId,
                                                                @PathVariable long ticketId) {
        TicketStatus status = proactiveConfirmUseCase.confirmNow(ticketId, userId);
        HttpStatus httpStatus = status == TicketStatus.PAID ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(httpStatus).body(PaymentStatusResponse.of(ticketId, status));
    }

    @Operation(summary = "티켓 취소", description = "환불 정책에 따라 자동으로 환불 여부를 결정합니다.")
    @DeleteMapping("/api/tickets/{ticketId}")
    public ResponseEntity<CancellationResponse> cancel(@RequestHeader("X-User-Id") long userId,
                                                       @PathVariable long ticketId) {
        return ResponseEntity.ok(CancellationResponse.from(
                cancelTicketUseCase.cancel(ticketId, userId, CancellationMode.AUTO)));
    }
}
