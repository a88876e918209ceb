package kr.jemi.zevent.ticket.infrastructure.config;

import kr.jemi.zevent.ticket.domain.PricingPolicy;
import kr.jemi.zevent.ticket.domain.RefundPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

@Configuration
public class TicketPolicyConfig {

    @Bean
    public PricingPolicy pricingPolicy(@Value("${zevent.ticket.pickup-price}") BigDecimal pickupPrice) {
        return new PricingPolicy(pickupPrice);
    }

    @Bean
    public RefundPolicy refundPolicy(@Value("${zevent.refund.enabled}") boolean enabled,
                                     @Value("${zevent.refund.notice-days}") int noticeDays,
                                     @Value("${zevent.refund.percent}") int percent) {
        return new RefundPolicy(enabled, noticeDays, percent);
    }
}
