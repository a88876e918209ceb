package kr.jemi.zevent.ticket.application.port.in;

public interface FinalizeCancellationsUseCase {

    int finalizeExpiredCancellations();
}
