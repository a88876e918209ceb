package kr.jemi.zevent.common.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import kr.jemi.zevent.common.exception.BusinessException;
import kr.jemi.zevent.common.exception.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.time.Duration;

/**
 * 관리자별 작업 횟수를 Redis에 기록하고, 윈도우 내 허용 횟수를 넘기면 일정 시간 차단한다.
 */
@Component
public class AdminRateLimitInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AdminRateLimitInterceptor.class);

    static final String ADMIN_HEADER = "X-Admin-Id";
    private static final String COUNT_KEY_PREFIX = "zevent:admin:actions:";
    private static final String BLOCK_KEY_PREFIX = "zevent:admin:blocked:";

    private final StringRedisTemplate redisTemplate;
    private final int maxActions;
    private final Duration window;
    private final Duration blockDuration;

    public AdminRateLimitInterceptor(StringRedisTemplate redisTemplate,
                                     @Value("${zevent.admin.rate-limit.max-actions}") int maxActions,
                                     @Value("${zevent.admin.rate-limit.window}") Duration window,
                                     @Value("${zevent.admin.rate-limit.block-duration}") Duration blockDuration) {
        this.redisTemplate = redisTemplate;
        this.maxActions = maxActions;
        this.window = window;
        this.blockDuration = blockDuration;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String adminId = request.getHeader(ADMIN_HEADER);
        if (adminId == null || adminId.isBlank()) {
            // 헤더 누락은 컨트롤러에서 400으로 처리
            return true;
        }

        if (Boolean.TRUE.equals(redisTemplate.hasKey(BLOCK_KEY_PREFIX + adminId))) {
            throw new BusinessException(ErrorCode.ADMIN_RATE_LIMITED);
        }

        String countKey = COUNT_KEY_PREFIX + adminId;
        Long count = redisTemplate.opsForValue().increment(countKey);
        if (count != null && count == 1L) {
            redisTemplate.expire(countKey, window);
        }
        if (count != null && count > maxActions) {
            redisTemplate.opsForValue().set(BLOCK_KEY_PREFIX + adminId, String.valueOf(count), blockDuration);
            redisTemplate.delete(countKey);
            log.warn("관리자 작업 한도 초과로 차단: adminId={}, count={}, block={}", adminId, count, blockDuration);
            throw new BusinessException(ErrorCode.ADMIN_RATE_LIMITED);
        }
        return true;
    }
}
