package kr.jemi.zevent.ticket.infrastructure.out.catalog;

import kr.jemi.zevent.ticket.application.port.out.BuyerPort;
import kr.jemi.zevent.ticket.domain.Buyer;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Component
@Transactional(readOnly = true)
public class BuyerJpaAdapter implements BuyerPort {

    private final BuyerJpaRepository repository;

    public BuyerJpaAdapter(BuyerJpaRepository repository) {
        this.repository = repository;
    }

    @Override
    public Optional<Buyer> findBuyer(long userId) {
        return repository.findById(userId).map(BuyerJpaEntity::toDomain);
    }
}
