package kr.jemi.zevent.ticket.infrastructure.out.payment.stripe;

import com.stripe.StripeClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * 전역 Stripe.apiKey를 쓰지 않고 키를 가진 클라이언트를 주입한다.
 */
@Configuration
public class StripeClientConfig {

    private static final Logger log = LoggerFactory.getLogger(StripeClientConfig.class);

    @Bean
    public StripeClient stripeClient(StripeProperties properties) {
        if (!StringUtils.hasText(properties.secretKey())) {
            log.warn("Stripe 시크릿 키가 설정되지 않음, Stripe 호출은 모두 실패한다");
        }
        return new StripeClient(properties.secretKey() == null ? "" : properties.secretKey());
    }
}
