package com.pos.checkout.util;

import com.pos.checkout.dto.CheckoutResult;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 重放缓存
 * - 按幂等键缓存已完结的结账结果，重放时无需访问数据库
 * - 缓存项携带请求指纹，指纹不一致时回落到数据库路径
 * - 未命中或 Redis 故障都不算错误，订单表才是事实来源
 */
@Slf4j
@Component
public class CheckoutResultCache {

    private static final String REPLAY_KEY_PREFIX = "checkout:replay:";
    private static final long DEFAULT_EXPIRE_HOURS = 24;

    private final RedisTemplate<String, Object> redisTemplate;

    public CheckoutResultCache(@Autowired(required = false) RedisTemplate<String, Object> redisTemplate,
                               @Value("${checkout.redis.enabled:false}") boolean redisEnabled) {
        this.redisTemplate = redisEnabled ? redisTemplate : null;
    }

    public CachedResult get(String idempotencyKey) {
        if (redisTemplate == null) {
            return null;
        }
        try {
            Object cached = redisTemplate.opsForValue().get(buildKey(idempotencyKey));
            if (cached instanceof CachedResult) {
                log.debug("[重放缓存命中] idempotencyKey={}", idempotencyKey);
                return (CachedResult) cached;
            }
        } catch (Exception e) {
            log.warn("[重放缓存读取失败] idempotencyKey={}, errorMsg={}", idempotencyKey, e.getMessage());
        }
        return null;
    }

    public void put(String idempotencyKey, String fingerprint, CheckoutResult result) {
        if (redisTemplate == null) {
            return;
        }
        try {
            redisTemplate.opsForValue().set(buildKey(idempotencyKey),
                    new CachedResult(fingerprint, result), DEFAULT_EXPIRE_HOURS, TimeUnit.HOURS);
        } catch (Exception e) {
            log.warn("[重放缓存写入失败] idempotencyKey={}, errorMsg={}", idempotencyKey, e.getMessage());
        }
    }

    private String buildKey(String idempotencyKey) {
        return REPLAY_KEY_PREFIX + idempotencyKey;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CachedResult {
        private String fingerprint;
        private CheckoutResult result;
    }
}
