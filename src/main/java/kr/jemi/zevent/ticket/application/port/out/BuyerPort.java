package kr.jemi.zevent.ticket.application.port.out;

import kr.jemi.zevent.ticket.domain.Buyer;

import java.util.Optional;

public interface BuyerPort {

    Optional<Buyer> findBuyer(long userId);
}
