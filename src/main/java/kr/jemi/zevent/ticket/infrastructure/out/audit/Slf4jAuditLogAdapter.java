package kr.jemi.zevent.ticket.infrastructure.out.audit;

import kr.jemi.zevent.ticket.application.port.out.AuditLogPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 감사 로그 저장은 외부 책임이다. 전용 AUDIT 로거로 내보내고 수집은 로깅 설정에 맡긴다.
 */
@Component
public class Slf4jAuditLogAdapter implements AuditLogPort {

    private static final Logger audit = LoggerFactory.getLogger("AUDIT");

    @Override
    public void record(String adminId, String action, long targetId, String detail) {
        audit.info("admin={} action={} target={} detail={}", adminId, action, targetId, detail);
    }
}
