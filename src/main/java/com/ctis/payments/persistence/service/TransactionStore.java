package com.ctis.payments.persistence.service;

import com.ctis.payments.domain.Actor;
import com.ctis.payments.domain.ActorType;
import com.ctis.payments.domain.AuditEntry;
import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.exception.TransactionNotFoundException;
import com.ctis.payments.persistence.entity.PaymentTransactionEntity;
import com.ctis.payments.persistence.entity.TransactionAuditEntity;
import com.ctis.payments.persistence.repository.PaymentTransactionRepository;
import com.ctis.payments.persistence.repository.TransactionAuditRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Persistence of gateway transactions and their audit trail. Every write is one
 * database transaction that changes the row and appends exactly one audit entry.
 * Callers never get entities back, only detached {@link PaymentTransaction} values.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionStore {

    private static final Set<TransactionStatus> IN_FLIGHT = EnumSet.of(
            TransactionStatus.INITIATED, TransactionStatus.PENDING, TransactionStatus.PROCESSING);

    private final PaymentTransactionRepository transactionRepository;
    private final TransactionAuditRepository auditRepository;

    /**
     * Inserts a new transaction together with its first audit entry.
     */
    @Transactional
    public PaymentTransaction create(PaymentTransactionEntity entity, Actor actor, String reason) {
        PaymentTransactionEntity saved = transactionRepository.saveAndFlush(entity);
        appendAudit(saved.getId(), actor, saved.getStatus(), saved.getStatus(), reason, saved.getInitiatedAt());
        log.debug("Persisted gateway transaction: id={}, reference={}", saved.getId(), saved.getTransactionReference());
        return TransactionMapper.toDomain(saved);
    }

    /**
     * Moves a transaction to {@code newStatus}, provided the row is still at
     * {@code expectedVersion}. A concurrent writer surfaces as
     * {@link org.springframework.dao.OptimisticLockingFailureException}, either from the
     * version comparison here or from the versioned UPDATE at flush time.
     *
     * @param mutation extra column changes committed with the status (e.g. external reference)
     */
    @Transactional
    public PaymentTransaction applyTransition(Long transactionId, Long expectedVersion, TransactionStatus newStatus,
                                              String reason, Actor actor, Instant at,
                                              Consumer<PaymentTransactionEntity> mutation) {
        PaymentTransactionEntity entity = transactionRepository.findById(transactionId)
                .orElseThrow(() -> TransactionNotFoundException.byId(transactionId));
        if (!Objects.equals(entity.getVersion(), expectedVersion)) {
            throw new ObjectOptimisticLockingFailureException(PaymentTransactionEntity.class, transactionId);
        }

        TransactionStatus previous = entity.getStatus();
        entity.setStatus(newStatus);
        entity.setStatusMessage(reason);
        switch (newStatus) {
            case PROCESSING -> entity.setProcessedAt(at);
            case COMPLETED -> entity.setCompletedAt(at);
            case FAILED, CANCELLED, EXPIRED -> entity.setFailedAt(at);
            default -> {
                // no timestamp for INITIATED / PENDING
            }
        }
        if (mutation != null) {
            mutation.accept(entity);
        }

        PaymentTransactionEntity saved = transactionRepository.saveAndFlush(entity);
        appendAudit(transactionId, actor, previous, newStatus, reason, at);
        return TransactionMapper.toDomain(saved);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentTransaction> findById(Long transactionId) {
        return transactionRepository.findById(transactionId).map(TransactionMapper::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentTransaction> findByReference(String transactionReference) {
        return transactionRepository.findByTransactionReference(transactionReference).map(TransactionMapper::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<PaymentTransaction> findByExternalReference(GatewayType gatewayType, String externalReference) {
        return transactionRepository.findByGatewayTypeAndExternalReference(gatewayType, externalReference)
                .map(TransactionMapper::toDomain);
    }

    /**
     * Oldest non-terminal transactions by initiation time, at most {@code limit}.
     */
    @Transactional(readOnly = true)
    public List<PaymentTransaction> findOldestInFlight(int limit) {
        return transactionRepository.findOldestByStatusIn(IN_FLIGHT, PageRequest.of(0, limit)).stream()
                .map(TransactionMapper::toDomain)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public List<AuditEntry> auditTrail(Long transactionId) {
        return auditRepository.findByTransactionIdOrderByIdAsc(transactionId).stream()
                .map(TransactionMapper::toDomain)
                .collect(Collectors.toList());
    }

    /**
     * Whether a webhook already moved this transaction into {@code status}.
     */
    @Transactional(readOnly = true)
    public boolean hasWebhookTransition(Long transactionId, TransactionStatus status) {
        return auditRepository.existsByTransactionIdAndActorTypeAndNewStatus(transactionId, ActorType.WEBHOOK, status);
    }

    private void appendAudit(Long transactionId, Actor actor, TransactionStatus previous, TransactionStatus next,
                             String reason, Instant at) {
        auditRepository.save(TransactionAuditEntity.builder()
                .transactionId(transactionId)
                .actorType(actor.getType())
                .actorName(actor.getName())
                .previousStatus(previous)
                .newStatus(next)
                .reason(reason)
                .createdAt(at)
                .build());
    }
}
