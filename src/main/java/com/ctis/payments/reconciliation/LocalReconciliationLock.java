package com.ctis.payments.reconciliation;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process lease for single-instance deployments and tests.
 */
@Component
@ConditionalOnProperty(name = "payment.reconciliation.lock.type", havingValue = "local")
public class LocalReconciliationLock implements ReconciliationLock {

    private final AtomicReference<String> holder = new AtomicReference<>();

    @Override
    public Optional<String> tryAcquire() {
        String token = UUID.randomUUID().toString();
        return holder.compareAndSet(null, token) ? Optional.of(token) : Optional.empty();
    }

    @Override
    public void release(String token) {
        holder.compareAndSet(token, null);
    }
}
