package kr.jemi.zevent.ticket.application.port.in;

public interface SweepStalePendingUseCase {

    int sweepStalePending();
}
