package kr.jemi.zevent.ticket.application.port.out;

import kr.jemi.zevent.ticket.domain.EventInfo;

import java.util.Optional;

public interface EventCatalogPort {

    Optional<EventInfo> findEvent(long eventId);
}
