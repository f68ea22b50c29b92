package com.ctis.payments.reconciliation;

import com.ctis.payments.config.ReconciliationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisReconciliationLockTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private ValueOperations<String, String> valueOperations;

    private RedisReconciliationLock lock;

    @BeforeEach
    void setUp() {
        ReconciliationProperties properties = new ReconciliationProperties();
        properties.getLock().setTtl(Duration.ofMinutes(2));
        lock = new RedisReconciliationLock(redisTemplate, properties);
    }

    @Test
    void acquiresWithSetIfAbsentAndTtl() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq("payment:reconciliation:lock"), anyString(), eq(Duration.ofMinutes(2))))
                .thenReturn(true);

        Optional<String> token = lock.tryAcquire();

        assertThat(token).isPresent();
    }

    @Test
    void heldLockIsNotAcquired() {
        when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        when(valueOperations.setIfAbsent(eq("payment:reconciliation:lock"), anyString(), eq(Duration.ofMinutes(2))))
                .thenReturn(false);

        assertThat(lock.tryAcquire()).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void releaseOnlyDeletesOwnToken() {
        when(redisTemplate.execute(eq(RedisReconciliationLock.RELEASE_SCRIPT), anyList(),
                eq("token-1"))).thenReturn(1L);

        lock.release("token-1");

        ArgumentCaptor<List<String>> keys = ArgumentCaptor.forClass(List.class);
        verify(redisTemplate).execute(eq(RedisReconciliationLock.RELEASE_SCRIPT), keys.capture(), eq("token-1"));
        assertThat(keys.getValue()).containsExactly("payment:reconciliation:lock");
        assertThat(RedisReconciliationLock.RELEASE_SCRIPT.getScriptAsString()).contains("GET").contains("DEL");
    }
}
