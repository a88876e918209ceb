package kr.jemi.zevent.ticket.infrastructure.out.payment.paypal;

import com.paypal.core.PayPalEnvironment;
import com.paypal.core.PayPalHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "zevent.paypal", name = "enabled", havingValue = "true")
public class PayPalClientConfig {

    private static final Logger log = LoggerFactory.getLogger(PayPalClientConfig.class);

    @Bean
    public PayPalHttpClient payPalHttpClient(PayPalProperties properties) {
        PayPalEnvironment environment = properties.isLive()
                ? new PayPalEnvironment.Live(properties.clientId(), properties.clientSecret())
                : new PayPalEnvironment.Sandbox(properties.clientId(), properties.clientSecret());
        log.info("PayPal 클라이언트 초기화: mode={}", properties.isLive() ? "live" : "sandbox");
        return new PayPalHttpClient(environment);
    }
}
