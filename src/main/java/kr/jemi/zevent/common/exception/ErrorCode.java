package kr.jemi.zevent.common.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {

    TICKET_NOT_FOUND(404, "티켓을 찾을 수 없습니다"),
    EVENT_NOT_FOUND(404, "이벤트를 찾을 수 없습니다"),
    BUYER_NOT_FOUND(404, "구매자를 찾을 수 없습니다"),
    GROUP_NOT_ALLOWED(403, "이 이벤트는 구매자 그룹에 허용되지 않습니다"),
    EVENT_SOLD_OUT(409, "잔여 좌석이 없습니다"),
    DUPLICATE_TICKET(409, "이미 이 이벤트의 유효한 티켓이 있습니다"),
    PURCHASE_IN_PROGRESS(409, "같은 이벤트에 대한 구매가 이미 진행 중입니다"),
    PICKUP_ADDRESS_REQUIRED(400, "픽업 서비스에는 픽업 주소가 필요합니다"),
    PAYMENT_PROVIDER_UNAVAILABLE(400, "사용할 수 없는 결제 수단입니다"),
    PAYMENT_PROVIDER_ERROR(502, "결제사 요청에 실패했습니다"),
    TICKET_NOT_PENDING(409, "결제 대기 상태의 티켓이 아닙니다"),
    TICKET_NOT_CANCELLABLE(409, "현재 상태에서는 티켓을 취소할 수 없습니다"),
    TICKET_NOT_REFUNDABLE(409, "결제 완료된 티켓만 환불할 수 있습니다"),
    REFUND_NOT_ELIGIBLE(422, "환불 가능 기간이 지났습니다"),
    REFUND_FAILED(502, "결제사 환불 요청에 실패했습니다"),
    INVALID_WEBHOOK_SIGNATURE(400, "웹훅 서명 검증에 실패했습니다"),
    INVALID_REQUEST(400, "잘못된 요청입니다"),
    ADMIN_RATE_LIMITED(429, "관리자 작업 한도를 초과하여 일시적으로 차단되었습니다"),
    INTERNAL_ERROR(500, "내부 서버 오류가 발생했습니다");

    private final HttpStatus status;
    private final String message;

    ErrorCode(int statusCode, String message) {
        this.status = HttpStatus.valueOf(statusCode);
        this.message = message;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
