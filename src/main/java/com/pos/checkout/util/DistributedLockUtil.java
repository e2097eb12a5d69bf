package com.pos.checkout.util;

import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 分布式锁工具
 * - 基于 Redisson 可重入锁，按资源加锁
 * - 保证跨实例同一幂等键只有一个编排器在处理
 * - 未接入 Redisson 时 tryLock 总是成功，数据库唯一约束仍会拒绝重复请求
 */
@Slf4j
@Component
public class DistributedLockUtil {

    private static DistributedLockUtil instance;
    private final RedissonClient redissonClient;

    private static final String LOCK_KEY_PREFIX = "lock:";

    public DistributedLockUtil(@Autowired(required = false) RedissonClient redissonClient) {
        this.redissonClient = redissonClient;
        instance = this;
    }

    public static boolean tryLock(String resourceKey, long waitTime, long leaseTime, TimeUnit unit) {
        if (instance == null || instance.redissonClient == null) {
            return true;
        }
        return instance.tryLockInternal(resourceKey, waitTime, leaseTime, unit);
    }

    private boolean tryLockInternal(String resourceKey, long waitTime, long leaseTime, TimeUnit unit) {
        RLock lock = redissonClient.getLock(buildLockKey(resourceKey));
        try {
            return lock.tryLock(waitTime, leaseTime, unit);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public static void unlock(String resourceKey) {
        if (instance == null || instance.redissonClient == null) {
            return;
        }
        RLock lock = instance.redissonClient.getLock(buildLockKey(resourceKey));
        if (lock.isHeldByCurrentThread()) {
            lock.unlock();
        } else {
            log.warn("[锁已过期] resourceKey={}", resourceKey);
        }
    }

    public static boolean isLocked(String resourceKey) {
        if (instance == null || instance.redissonClient == null) {
            return false;
        }
        return instance.redissonClient.getLock(buildLockKey(resourceKey)).isLocked();
    }

    private static String buildLockKey(String resourceKey) {
        return LOCK_KEY_PREFIX + resourceKey;
    }
}
