package com.ctis.payments.persistence.entity;

import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.persistence.converter.MetadataJsonConverter;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Persistent gateway transaction. {@link #version} is the optimistic concurrency token
 * every status change is checked against.
 */
@Entity
@Table(name = "payment_gateway_transactions",
        uniqueConstraints = {
            @UniqueConstraint(name = "uk_gateway_tx_reference", columnNames = "transaction_reference"),
            @UniqueConstraint(name = "uk_gateway_tx_external_ref", columnNames = {"gateway_type", "external_reference"})
        },
        indexes = {
            @Index(name = "idx_gateway_tx_status_initiated", columnList = "status, initiated_at"),
            @Index(name = "idx_gateway_tx_client_id", columnList = "client_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentTransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "transaction_reference", nullable = false, length = 100)
    private String transactionReference;

    @Column(name = "external_reference", length = 100)
    private String externalReference;

    @Column(name = "client_id", nullable = false, length = 64)
    private String clientId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "gateway_type", nullable = false, length = 32)
    private GatewayType gatewayType;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TransactionStatus status;

    @Column(name = "initiated_at", nullable = false, updatable = false)
    private Instant initiatedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "status_message", length = 2000)
    private String statusMessage;

    @Column(name = "initiated_by", length = 100)
    private String initiatedBy;

    @Convert(converter = MetadataJsonConverter.class)
    @Column(name = "metadata", length = 4000)
    private Map<String, String> metadata;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;
}
