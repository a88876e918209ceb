package kr.jemi.zevent.notification.application.port.out;

import kr.jemi.zevent.notification.domain.TicketConfirmation;

public interface ConfirmationMailPort {

    void send(TicketConfirmation confirmation);
}
