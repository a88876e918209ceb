package kr.jemi.zevent.notification.application.service;

import kr.jemi.zevent.notification.application.port.out.ConfirmationMailPort;
import kr.jemi.zevent.notification.application.port.out.OperatorAlertPort;
import kr.jemi.zevent.notification.domain.OperatorAlert;
import kr.jemi.zevent.notification.domain.TicketConfirmation;
import kr.jemi.zevent.ticket.api.OrphanedPaymentDetectedEvent;
import kr.jemi.zevent.ticket.api.TicketPaidEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.modulith.events.ApplicationModuleListener;
import org.springframework.stereotype.Component;

/**
 * 티켓 모듈 이벤트를 커밋 이후 비동기로 받는다.
 * 실패한 발행은 이벤트 레지스트리에 남아 EventResubmitScheduler가 다시 보낸다.
 */
@Component
public class TicketNotificationListener {

    private static final Logger log = LoggerFactory.getLogger(TicketNotificationListener.class);

    private final ConfirmationMailPort confirmationMailPort;
    private final OperatorAlertPort operatorAlertPort;

    public TicketNotificationListener(ConfirmationMailPort confirmationMailPort,
                                      OperatorAlertPort operatorAlertPort) {
        this.confirmationMailPort = confirmationMailPort;
        this.operatorAlertPort = operatorAlertPort;
    }

    @ApplicationModuleListener
    public void onTicketPaid(TicketPaidEvent event) {
        confirmationMailPort.send(new TicketConfirmation(
                event.ticketId(), event.userId(), event.eventId(), event.totalAmount(), event.paymentProvider()));
        if (event.reactivated()) {
            operatorAlertPort.alert(OperatorAlert.reactivatedTicket(event.ticketId(), event.paymentProvider()));
        }
    }

    @ApplicationModuleListener
    public void onOrphanedPayment(OrphanedPaymentDetectedEvent event) {
        log.error("고아 결제 감지: ticketId={}, provider={}, checkoutId={}, paymentId={}, status={}",
                event.ticketId(), event.paymentProvider(), event.checkoutId(), event.paymentId(), event.ticketStatus());
        operatorAlertPort.alert(OperatorAlert.orphanedPayment(
                event.ticketId(), event.paymentProvider(), event.checkoutId(), event.paymentId(), event.ticketStatus()));
    }
}
