package kr.jemi.zevent.ticket.infrastructure.in.webhook;

public enum WebhookResult {
    PROCESSED,
    IGNORED
}
