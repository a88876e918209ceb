package kr.jemi.zevent.ticket.application.service;

import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import kr.jemi.zevent.ticket.application.port.out.PaymentProviderPort;
import kr.jemi.zevent.ticket.domain.PaymentProviderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class PaymentProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(PaymentProviderRegistry.class);

    private final Map<PaymentProviderType, PaymentProviderPort> providers = new EnumMap<>(PaymentProviderType.class);
    private final PaymentProviderType defaultProvider;

    public PaymentProviderRegistry(List<PaymentProviderPort> providerPorts,
                                   @Value("${zevent.ticket.default-provider}") String defaultProvider) {
        for (PaymentProviderPort port : providerPorts) {
            providers.put(port.providerName(), port);
        }
        this.defaultProvider = PaymentProviderType.from(defaultProvider);
        log.info("결제사 등록: {}, 기본값: {}", providers.keySet(), this.defaultProvider);
    }

    /**
     * 요청값이 없으면 기본 결제사를 쓴다.
     */
    public PaymentProviderPort resolve(PaymentProviderType requested) {
        return get(requested != null ? requested : defaultProvider);
    }

    public PaymentProviderPort get(PaymentProviderType type) {
        PaymentProviderPort port = type == null ? null : providers.get(type);
        if (port == null) {
            throw new BusinessException(ErrorCode.PAYMENT_PROVIDER_UNAVAILABLE);
        }
        return port;
    }
}
