package kr.jemi.zevent.notification.application.port.out;

import kr.jemi.zevent.notification.domain.OperatorAlert;

public interface OperatorAlertPort {

    void alert(OperatorAlert alert);
}
