package kr.jemi.zevent.ticket.infrastructure.in.web;

import io.swagger.v3.oas.annotations.Hidden;
import kr.jemi.zevent.ticket.infrastructure.in.webhook.StripeWebhookHandler;
import kr.jemi.zevent.ticket.infrastructure.in.webhook.WebhookResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Hidden
@RestController
public class StripeWebhookController {

    private final StripeWebhookHandler stripeWebhookHandler;

    public StripeWebhookController(StripeWebhookHandler stripeWebhookHandler) {
        this.stripeWebhookHandler = stripeWebhookHandler;
    }

    // 서명은 원문 바이트 기준이라 String으로 받는다
    @PostMapping("/webhooks/stripe")
    public ResponseEntity<Map<String, String>> receive(
            @RequestBody String payload,
            @RequestHeader(value = "Stripe-Signature", required = false) String signature) {
        WebhookResult result = stripeWebhookHandler.handle(payload, signature);
        return ResponseEntity.ok(Map.of("result", result.name().toLowerCase()));
    }
}
