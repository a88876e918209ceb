package kr.jemi.zevent.notification.domain;

import java.math.BigDecimal;

public record TicketConfirmation(long ticketId,
                                 long userId,
                                 long eventId,
                                 BigDecimal totalAmount,
                                 String paymentProvider) {

    public String subject() {
        return "[zevent] 티켓 결제가 완료되었습니다 (#" + ticketId + ")";
    }
}
