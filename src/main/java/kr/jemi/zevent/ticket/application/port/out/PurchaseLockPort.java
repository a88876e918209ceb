package kr.jemi.zevent.ticket.application.port.out;

public interface PurchaseLockPort {

    boolean tryLock(long userId, long eventId, String owner, long ttlSeconds);

    void unlock(long userId, long eventId, String owner);
}
