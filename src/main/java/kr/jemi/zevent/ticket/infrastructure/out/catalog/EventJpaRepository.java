package kr.jemi.zevent.ticket.infrastructure.out.catalog;

import org.springframework.data.jpa.repository.JpaRepository;

public interface EventJpaRepository extends JpaRepository<EventJpaEntity, Long> {
}
