package kr.jemi.zevent.ticket.infrastructure.out.redis;

import kr.jemi.zevent.ticket.application.port.out.PurchaseLockPort;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
public class PurchaseLockRedisAdapter implements PurchaseLockPort {

    private static final String KEY_PREFIX = "zevent:purchase-lock:";

    private final StringRedisTemplate redisTemplate;
    private final DefaultRedisScript<Long> releaseLockScript;

    public PurchaseLockRedisAdapter(StringRedisTemplate redisTemplate,
                                    DefaultRedisScript<Long> releaseLockScript) {
        this.redisTemplate = redisTemplate;
        this.releaseLockScript = releaseLockScript;
    }

    @Override
    public boolean tryLock(long userId, long eventId, String owner, long ttlSeconds) {
        Boolean success = redisTemplate.opsForValue()
                .setIfAbsent(key(userId, eventId), owner, ttlSeconds, TimeUnit.SECONDS);
        return Boolean.TRUE.equals(success);
    }

    // 자신이 잡은 락만 해제한다 (TTL 만료 후 다른 요청이 잡은 락 보호)
    @Override
    public void unlock(long userId, long eventId, String owner) {
        redisTemplate.execute(releaseLockScript, List.of(key(userId, eventId)), owner);
    }

    private String key(long userId, long eventId) {
        return KEY_PREFIX + userId + ":" + eventId;
    }
}
