package kr.jemi.zevent.ticket.infrastructure.out.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import kr.jemi.zevent.ticket.domain.Buyer;
import kr.jemi.zevent.ticket.domain.BuyerGroup;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "users")
public class BuyerJpaEntity {

    @Id
    private Long id;

    @Column(nullable = false)
    private String email;

    @Column(name = "user_group", nullable = false, length = 16)
    private String group;

    protected BuyerJpaEntity() {}

    public Buyer toDomain() {
        return new Buyer(id, email, BuyerGroup.valueOf(group.trim().toUpperCase()));
    }
}
