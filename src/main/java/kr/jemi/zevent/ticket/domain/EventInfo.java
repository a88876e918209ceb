package kr.jemi.zevent.ticket.domain;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 티켓 구매에 필요한 이벤트 정보. allowedGroup이 null이면 모든 그룹에 열려 있다.
 */
public record EventInfo(long id,
                        String name,
                        LocalDateTime startsAt,
                        int capacity,
                        BuyerGroup allowedGroup,
                        BigDecimal guestsPrice,
                        BigDecimal bubblePrice,
                        BigDecimal plusPrice) {

    public BigDecimal priceFor(BuyerGroup group) {
        return switch (group) {
            case GUESTS -> guestsPrice;
            case BUBBLE -> bubblePrice;
            case PLUS -> plusPrice;
        };
    }

    public boolean isOpenTo(BuyerGroup group) {
        return allowedGroup == null || allowedGroup == group;
    }
}
