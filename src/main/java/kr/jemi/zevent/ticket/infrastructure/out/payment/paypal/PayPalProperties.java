package kr.jemi.zevent.ticket.infrastructure.out.payment.paypal;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "zevent.paypal")
public record PayPalProperties(
        boolean enabled,
        String mode,
        String clientId,
        String clientSecret,
        String webhookId,
        boolean verifyWebhookSignature,
        String brandName,
        String successUrl,
        String cancelUrl
) {

    public boolean isLive() {
        return "live".equalsIgnoreCase(mode);
    }
}
