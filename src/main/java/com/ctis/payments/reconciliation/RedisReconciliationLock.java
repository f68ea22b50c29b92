package com.ctis.payments.reconciliation;

import com.ctis.payments.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.Optional;
import java.util.UUID;

/**
 * Lease held in Redis with {@code SET NX PX}; shared by every instance of the service.
 * The lease expires on its own if the holder dies mid-sweep.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "payment.reconciliation.lock.type", havingValue = "redis", matchIfMissing = true)
public class RedisReconciliationLock implements ReconciliationLock {

    static final DefaultRedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('GET', KEYS[1]) == ARGV[1] then return redis.call('DEL', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final ReconciliationProperties properties;

    @Override
    public Optional<String> tryAcquire() {
        String key = properties.getLock().getKey();
        String token = UUID.randomUUID().toString();
        Boolean acquired = redisTemplate.opsForValue().setIfAbsent(key, token, properties.getLock().getTtl());
        if (Boolean.TRUE.equals(acquired)) {
            log.debug("Acquired reconciliation lock {} with token {}", key, token);
            return Optional.of(token);
        }
        log.debug("Reconciliation lock {} is held elsewhere", key);
        return Optional.empty();
    }

    @Override
    public void release(String token) {
        String key = properties.getLock().getKey();
        Long deleted = redisTemplate.execute(RELEASE_SCRIPT, Collections.singletonList(key), token);
        if (deleted == null || deleted == 0L) {
            log.warn("Reconciliation lock {} was no longer held by token {} at release (lease expired?)", key, token);
        }
    }
}
