package kr.jemi.zevent.ticket.infrastructure.out.catalog;

import kr.jemi.zevent.ticket.application.port.out.EventCatalogPort;
import kr.jemi.zevent.ticket.domain.EventInfo;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@Transactional(readOnly = true)
public class EventCatalogJpaAdapter implements EventCatalogPort {

    private final EventJpaRepository repository;

    public EventCatalogJpaAdapter(EventJpaRepository repository) {
        this.repository = repository;
    }

    // 비활성 이벤트는 없는 것으로 본다
    @Override
    public Optional<EventInfo> findEvent(long eventId) {
        return repository.findById(eventId)
                .filter(EventJpaEntity::isActive)
                .map(EventJpaEntity::toDomain);
    }
}
