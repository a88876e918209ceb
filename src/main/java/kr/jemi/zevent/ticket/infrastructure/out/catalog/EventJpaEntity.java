package kr.jemi.zevent.ticket.infrastructure.out.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import kr.jemi.zevent.ticket.domain.BuyerGroup;
import kr.jemi.zevent.ticket.domain.EventInfo;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 이벤트 관리는 외부 책임이다. 티켓 구매에 필요한 컬럼만 읽는다.
 */
@Entity
@Immutable
@Table(name = "events")
public class EventJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private LocalDateTime startsAt;

    @Column(nullable = false)
    private int maxParticipants;

    @Column(length = 16)
    private String allowedGroup;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal guestsPrice;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal bubblePrice;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal plusPrice;

    @Column(nullable = false)
    private boolean active;

    protected EventJpaEntity() {}

    public boolean isActive() {
        return active;
    }

    public EventInfo toDomain() {
        BuyerGroup group = allowedGroup == null || allowedGroup.isBlank()
                ? null
                : BuyerGroup.valueOf(allowedGroup.trim().toUpperCase());
        return new EventInfo(id, name, startsAt, maxParticipants, group, guestsPrice, bubblePrice, plusPrice);
    }
}
