package kr.jemi.zevent.ticket.application.port.out;

public interface AuditLogPort {

    void record(String adminId, String action, long targetId, String detail);
}
