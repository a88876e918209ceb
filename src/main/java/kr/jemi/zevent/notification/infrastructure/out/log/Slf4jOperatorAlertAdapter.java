package kr.jemi.zevent.notification.infrastructure.out.log;

import kr.jemi.zevent.notification.application.port.out.OperatorAlertPort;
import kr.jemi.zevent.notification.domain.OperatorAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class Slf4jOperatorAlertAdapter implements OperatorAlertPort {

    private static final Logger log = LoggerFactory.getLogger("OPERATOR_ALERT");

    @Override
    public void alert(OperatorAlert alert) {
        if (alert.severity() == OperatorAlert.Severity.CRITICAL) {
            log.error("[{}] {} - {}", alert.severity(), alert.title(), alert.detail());
        } else {
            log.warn("[{}] {} - {}", alert.severity(), alert.title(), alert.detail());
        }
    }
}
