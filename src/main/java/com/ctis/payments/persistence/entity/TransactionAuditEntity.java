package com.ctis.payments.persistence.entity;

import com.ctis.payments.domain.ActorType;
import com.ctis.payments.domain.TransactionStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only audit trail: one row per status change, written in the same database
 * transaction as the change itself. Never updated or deleted.
 */
@Entity
@Table(name = "payment_transaction_audit", indexes = {
    @Index(name = "idx_tx_audit_transaction", columnList = "transaction_id"),
    @Index(name = "idx_tx_audit_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionAuditEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_id", nullable = false, updatable = false)
    private Long transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "actor_type", nullable = false, updatable = false, length = 16)
    private ActorType actorType;

    @Column(name = "actor_name", nullable = false, updatable = false, length = 100)
    private String actorName;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_status", nullable = false, updatable = false, length = 16)
    private TransactionStatus previousStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "new_status", nullable = false, updatable = false, length = 16)
    private TransactionStatus newStatus;

    @Column(name = "reason", updatable = false, length = 2000)
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
