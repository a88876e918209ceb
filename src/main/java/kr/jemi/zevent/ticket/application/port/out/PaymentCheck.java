package kr.jemi.zevent.ticket.application.port.out;

import kr.jemi.zevent.ticket.domain.CaptureOutcome;
import kr.jemi.zevent.ticket.domain.PaymentReference;

public record PaymentCheck(CaptureOutcome outcome, PaymentReference reference) {

    public static PaymentCheck pending() {
        return new PaymentCheck(CaptureOutcome.PENDING, null);
    }

    public static PaymentCheck abandoned() {
        return new PaymentCheck(CaptureOutcome.ABANDONED, null);
    }

    public static PaymentCheck captured(PaymentReference reference) {
        return new PaymentCheck(CaptureOutcome.CAPTURED, reference);
    }
}
