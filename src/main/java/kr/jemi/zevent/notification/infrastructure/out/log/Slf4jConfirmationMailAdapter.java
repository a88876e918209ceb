package kr.jemi.zevent.notification.infrastructure.out.log;

import kr.jemi.zevent.notification.application.port.out.ConfirmationMailPort;
import kr.jemi.zevent.notification.domain.TicketConfirmation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 메일 발송 연동 전까지 발송 내용을 로그로 남긴다.
 */
@Component
public class Slf4jConfirmationMailAdapter implements ConfirmationMailPort {

    private static final Logger log = LoggerFactory.getLogger("NOTIFICATION");

    @Override
    public void send(TicketConfirmation confirmation) {
        log.info("구매 확인 메일: userId={}, subject={}, eventId={}, total={} EUR, provider={}",
                confirmation.userId(), confirmation.subject(), confirmation.eventId(),
                confirmation.totalAmount(), confirmation.paymentProvider());
    }
}
