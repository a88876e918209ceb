package kr.jemi.zevent.ticket.infrastructure.in.webhook;

import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.security.cert.X509Certificate;
import java.util.Base64;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * PayPal 웹훅 오프라인 서명 검증.
 * 서명 대상: transmissionId|transmissionTime|webhookId|crc32(body)
 */
@Component
@ConditionalOnProperty(prefix = "zevent.paypal", name = "enabled", havingValue = "true")
public class PayPalWebhookVerifier {

    private static final Logger log = LoggerFactory.getLogger(PayPalWebhookVerifier.class);

    static final String SIGNATURE_ALGORITHM = "SHA256withRSA";

    private final PayPalCertificateClient certificateClient;
    private final String webhookId;
    private final boolean verificationEnabled;

    public PayPalWebhookVerifier(PayPalCertificateClient certificateClient,
                                 @Value("${zevent.paypal.webhook-id}") String webhookId,
                                 @Value("${zevent.paypal.verify-webhook-signature}") boolean verificationEnabled) {
        this.certificateClient = certificateClient;
        this.webhookId = webhookId;
        this.verificationEnabled = verificationEnabled;
        if (!verificationEnabled) {
            log.warn("PayPal 웹훅 서명 검증이 꺼져 있음. 로컬 샌드박스 외에는 사용하지 말 것");
        }
    }

    public void verify(PayPalTransmission transmission, String payload) {
        if (!verificationEnabled) {
            log.warn("보안 경고: 서명 검증 없이 PayPal 웹훅 처리, transmissionId={}", transmission.transmissionId());
            return;
        }
        if (!transmission.isComplete() || !StringUtils.hasText(webhookId)) {
            log.warn("PayPal 웹훅 서명 헤더 누락 또는 webhookId 미설정");
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        }
        if (transmission.authAlgo() != null && !SIGNATURE_ALGORITHM.equalsIgnoreCase(transmission.authAlgo())) {
            log.warn("지원하지 않는 PayPal 서명 알고리즘: {}", transmission.authAlgo());
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        }
        requireTrustedCertUrl(transmission.certUrl());

        X509Certificate certificate = certificateClient.fetch(transmission.certUrl());
        String expected = transmission.transmissionId()
                + "|" + transmission.transmissionTime()
                + "|" + webhookId
                + "|" + crc32(payload);
        try {
            certificate.checkValidity();
            Signature signature = Signature.getInstance(SIGNATURE_ALGORITHM);
            signature.initVerify(certificate.getPublicKey());
            signature.update(expected.getBytes(StandardCharsets.UTF_8));
            if (!signature.verify(Base64.getDecoder().decode(transmission.transmissionSig()))) {
                log.warn("PayPal 웹훅 서명 불일치: transmissionId={}", transmission.transmissionId());
                throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
            }
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.warn("PayPal 웹훅 서명 검증 오류: transmissionId={}, cause={}",
                    transmission.transmissionId(), e.getMessage());
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, e);
        }
    }

    // 공격자가 자기 인증서로 서명하지 못하도록 PayPal 도메인만 허용
    private void requireTrustedCertUrl(String certUrl) {
        URI uri;
        try {
            uri = URI.create(certUrl);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, e);
        }
        String host = uri.getHost() == null ? "" : uri.getHost().toLowerCase(Locale.ROOT);
        if (!"https".equalsIgnoreCase(uri.getScheme()) || !host.endsWith(".paypal.com")) {
            log.warn("신뢰할 수 없는 PayPal 인증서 URL: {}", certUrl);
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        }
    }

    static long crc32(String payload) {
        CRC32 crc = new CRC32();
        crc.update(payload.getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
