package com.ctis.payments.reconciliation;

import com.ctis.payments.config.ReconciliationProperties;
import com.ctis.payments.core.PaymentGatewayService;
import com.ctis.payments.domain.Actor;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.ProviderStatus;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.persistence.service.TransactionStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Periodic sweep over non-terminal transactions: expires abandoned sessions, pulls
 * outcomes from providers that missed their webhook, and fails rows stuck past their
 * timeout. One runner at a time across the cluster.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentReconciliationJob {

    static final String JOB_NAME = "payment-reconciliation";
    static final String PENDING_TIMEOUT_REASON = "pending timeout exceeded";
    static final String PROCESSING_TIMEOUT_REASON = "processing timeout exceeded";

    private static final Actor ACTOR = Actor.scheduler(JOB_NAME);

    private final TransactionStore store;
    private final PaymentGatewayService gatewayService;
    private final ReconciliationLock lock;
    private final ReconciliationProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean();
    private volatile boolean stopping;

    @Scheduled(fixedDelayString = "${payment.reconciliation.interval:PT1M}",
            initialDelayString = "${payment.reconciliation.initial-delay:PT30S}")
    public void sweep() {
        if (!properties.isEnabled()) {
            return;
        }
        ReconciliationReport report = runOnce(() -> stopping || Thread.currentThread().isInterrupted());
        if (!report.isSkipped() && report.getInspected() > 0) {
            log.info("Reconciliation sweep: inspected={}, updated={}, errors={}, cancelled={}",
                    report.getInspected(), report.getUpdated(), report.getErrors(), report.isCancelled());
        }
    }

    /**
     * Runs one sweep unless another one holds the in-process guard or the shared lock.
     *
     * @param cancelled checked before every row; a row already started always finishes
     */
    public ReconciliationReport runOnce(BooleanSupplier cancelled) {
        Instant startedAt = Instant.now(clock);
        if (!running.compareAndSet(false, true)) {
            log.debug("Reconciliation already running in this instance; skipping");
            return ReconciliationReport.skipped(startedAt);
        }
        try {
            Optional<String> token = lock.tryAcquire();
            if (token.isEmpty()) {
                log.debug("Reconciliation lock held by another instance; skipping");
                return ReconciliationReport.skipped(startedAt);
            }
            try {
                return reconcileBatch(startedAt, cancelled);
            } finally {
                lock.release(token.get());
            }
        } finally {
            running.set(false);
        }
    }

    @PreDestroy
    void stop() {
        stopping = true;
    }

    private ReconciliationReport reconcileBatch(Instant startedAt, BooleanSupplier cancelled) {
        List<PaymentTransaction> batch = store.findOldestInFlight(properties.getBatchSize());
        int inspected = 0;
        int updated = 0;
        int errors = 0;
        boolean wasCancelled = false;

        for (PaymentTransaction transaction : batch) {
            if (cancelled.getAsBoolean()) {
                log.info("Reconciliation cancelled after {} of {} transactions", inspected, batch.size());
                wasCancelled = true;
                break;
            }
            inspected++;
            try {
                if (reconcile(transaction)) {
                    updated++;
                }
            } catch (Exception e) {
                errors++;
                log.error("Reconciliation failed for transaction {} ({}): {}",
                        transaction.getId(), transaction.getTransactionReference(), e.getMessage(), e);
            }
        }
        return ReconciliationReport.builder()
                .startedAt(startedAt)
                .inspected(inspected)
                .updated(updated)
                .errors(errors)
                .cancelled(wasCancelled)
                .build();
    }

    /**
     * @return true when the transaction's status changed
     */
    boolean reconcile(PaymentTransaction transaction) {
        Long id = transaction.getId();
        Instant now = Instant.now(clock);

        if (transaction.getStatus() == TransactionStatus.INITIATED) {
            if (now.isBefore(transaction.getInitiatedAt().plus(properties.getDispatchGracePeriod()))) {
                return false;
            }
            return gatewayService.expire(id, ACTOR);
        }

        if (transaction.isExpiredAt(now)) {
            return gatewayService.expire(id, ACTOR);
        }

        ProviderStatus providerStatus = gatewayService.checkStatus(id, ACTOR);
        if (!providerStatus.isReachable()) {
            log.debug("Provider unreachable for transaction {}: {}", id, providerStatus.getMessage());
        }

        PaymentTransaction current = gatewayService.getTransaction(id);
        if (current.isTerminal()) {
            return current.getStatus() != transaction.getStatus();
        }
        if (current.getStatus() == TransactionStatus.PENDING
                && !now.isBefore(current.getInitiatedAt().plus(properties.getPendingTimeout()))) {
            return gatewayService.updateStatus(id, TransactionStatus.FAILED, PENDING_TIMEOUT_REASON, ACTOR);
        }
        if (current.getStatus() == TransactionStatus.PROCESSING) {
            Instant processedAt = current.getProcessedAt() != null ? current.getProcessedAt() : current.getInitiatedAt();
            if (!now.isBefore(processedAt.plus(properties.getProcessingTimeout()))) {
                return gatewayService.updateStatus(id, TransactionStatus.FAILED, PROCESSING_TIMEOUT_REASON, ACTOR);
            }
        }
        return false;
    }
}
