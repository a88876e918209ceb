package kr.jemi.zevent.ticket.infrastructure.in.webhook;

import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;

/**
 * PayPal 서명 인증서를 내려받는다. 인증서는 URL 단위로 캐시한다.
 */
@Component
@ConditionalOnProperty(prefix = "zevent.paypal", name = "enabled", havingValue = "true")
public class PayPalCertificateClient {

    private static final Logger log = LoggerFactory.getLogger(PayPalCertificateClient.class);

    private final RestClient restClient;

    public PayPalCertificateClient(RestClient.Builder restClientBuilder) {
        this.restClient = restClientBuilder.build();
    }

    @Cacheable("paypalCertificates")
    public X509Certificate fetch(String certUrl) {
        byte[] body;
        try {
            body = restClient.get()
                    .uri(URI.create(certUrl))
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientException e) {
            log.warn("PayPal 인증서 다운로드 실패: url={}, cause={}", certUrl, e.getMessage());
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, e);
        }
        if (body == null || body.length == 0) {
            log.warn("PayPal 인증서 응답이 비어 있음: url={}", certUrl);
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE);
        }
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(body));
        } catch (CertificateException e) {
            log.warn("PayPal 인증서 파싱 실패: url={}", certUrl, e);
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_SIGNATURE, e);
        }
    }
}
