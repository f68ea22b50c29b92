package com.ctis.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a persisted gateway transaction, handed to adapters, side-effect
 * collaborators and the REST layer. {@code version} is the concurrency token it was read at.
 */
@Value
@Builder(toBuilder = true)
public class PaymentTransaction {

    Long id;
    String transactionReference;
    String externalReference;
    String clientId;
    BigDecimal amount;
    String currency;
    GatewayType gatewayType;
    TransactionStatus status;
    Instant initiatedAt;
    Instant processedAt;
    Instant completedAt;
    Instant failedAt;
    Instant expiresAt;
    String statusMessage;
    String initiatedBy;
    Long version;
    Map<String, String> metadata;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
