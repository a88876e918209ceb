package kr.jemi.zevent.ticket.domain;

public record Buyer(long id, String email, BuyerGroup group) {
}
