package com.ctis.payments.api;

import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.TransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * REST view of a gateway transaction.
 */
@Value
@Builder
public class TransactionResponseDto {

    Long transactionId;
    String transactionReference;
    String externalReference;
    String clientId;
    BigDecimal amount;
    String currency;
    GatewayType gatewayType;
    TransactionStatus status;
    String statusMessage;
    Instant initiatedAt;
    Instant processedAt;
    Instant completedAt;
    Instant failedAt;
    Instant expiresAt;
    Map<String, String> metadata;

    public static TransactionResponseDto from(PaymentTransaction transaction) {
        if (transaction == null) {
            throw new IllegalArgumentException("PaymentTransaction cannot be null");
        }
        return TransactionResponseDto.builder()
                .transactionId(transaction.getId())
                .transactionReference(transaction.getTransactionReference())
                .externalReference(transaction.getExternalReference())
                .clientId(transaction.getClientId())
                .amount(transaction.getAmount())
                .currency(transaction.getCurrency())
                .gatewayType(transaction.getGatewayType())
                .status(transaction.getStatus())
                .statusMessage(transaction.getStatusMessage())
                .initiatedAt(transaction.getInitiatedAt())
                .processedAt(transaction.getProcessedAt())
                .completedAt(transaction.getCompletedAt())
                .failedAt(transaction.getFailedAt())
                .expiresAt(transaction.getExpiresAt())
                .metadata(transaction.getMetadata())
                .build();
    }
}
