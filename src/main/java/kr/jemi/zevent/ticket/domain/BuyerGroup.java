package kr.jemi.zevent.ticket.domain;

public enum BuyerGroup {
    GUESTS,
    BUBBLE,
    PLUS
}
