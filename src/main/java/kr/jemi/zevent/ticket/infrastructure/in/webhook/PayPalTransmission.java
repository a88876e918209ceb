package kr.jemi.zevent.ticket.infrastructure.in.webhook;

/**
 * PayPal 웹훅 요청의 PAYPAL-* 서명 헤더.
 */
public record PayPalTransmission(String transmissionId,
                                 String transmissionTime,
                                 String transmissionSig,
                                 String certUrl,
                                 String authAlgo) {

    public boolean isComplete() {
        return hasText(transmissionId) && hasText(transmissionTime)
                && hasText(transmissionSig) && hasText(certUrl);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
