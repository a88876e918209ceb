package kr.jemi.zevent.ticket.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Hidden;
import kr.jemi.zevent.ticket.infrastructure.in.webhook.PayPalTransmission;
import kr.jemi.zevent.ticket.infrastructure.in.webhook.PayPalWebhookHandler;
import kr.jemi.zevent.ticket.infrastructure.in.webhook.WebhookResult;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Hidden
@RestController
@ConditionalOnProperty(prefix = "zevent.paypal", name = "enabled", havingValue = "true")
public class PayPalWebhookController {

    private final PayPalWebhookHandler payPalWebhookHandler;

    public PayPalWebhookController(PayPalWebhookHandler payPalWebhookHandler) {
        this.payPalWebhookHandler = payPalWebhookHandler;
    }

    @PostMapping("/webhooks/paypal")
    public ResponseEntity<Map<String, String>> receive(
            @RequestBody String payload,
            @RequestHeader(value = "PAYPAL-TRANSMISSION-ID", required = false) String transmissionId,
            @RequestHeader(value = "PAYPAL-TRANSMISSION-TIME", required = false) String transmissionTime,
            @RequestHeader(value = "PAYPAL-TRANSMISSION-SIG", required = false) String transmissionSig,
            @RequestHeader(value = "PAYPAL-CERT-URL", required = false) String certUrl,
            @RequestHeader(value = "PAYPAL-AUTH-ALGO", required = false) String authAlgo) {
        PayPalTransmission transmission =
                new PayPalTransmission(transmissionId, transmissionTime, transmissionSig, certUrl, authAlgo);
        WebhookResult result = payPalWebhookHandler.handle(payload, transmission);
        return ResponseEntity.ok(Map.of("result", result.name().toLowerCase()));
    }
}
