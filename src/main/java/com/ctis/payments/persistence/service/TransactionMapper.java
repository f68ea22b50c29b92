package com.ctis.payments.persistence.service;

import com.ctis.payments.domain.AuditEntry;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.persistence.entity.PaymentTransactionEntity;
import com.ctis.payments.persistence.entity.TransactionAuditEntity;

import java.util.Map;

/**
 * Entity to domain conversions. Domain values are detached copies and safe to hand out.
 */
final class TransactionMapper {

    private TransactionMapper() {
    }

    static PaymentTransaction toDomain(PaymentTransactionEntity entity) {
        return PaymentTransaction.builder()
                .id(entity.getId())
                .transactionReference(entity.getTransactionReference())
                .externalReference(entity.getExternalReference())
                .clientId(entity.getClientId())
                .amount(entity.getAmount())
                .currency(entity.getCurrency())
                .gatewayType(entity.getGatewayType())
                .status(entity.getStatus())
                .initiatedAt(entity.getInitiatedAt())
                .processedAt(entity.getProcessedAt())
                .completedAt(entity.getCompletedAt())
                .failedAt(entity.getFailedAt())
                .expiresAt(entity.getExpiresAt())
                .statusMessage(entity.getStatusMessage())
                .initiatedBy(entity.getInitiatedBy())
                .version(entity.getVersion())
                .metadata(entity.getMetadata() != null ? Map.copyOf(entity.getMetadata()) : Map.of())
                .build();
    }

    static AuditEntry toDomain(TransactionAuditEntity entity) {
        return AuditEntry.builder()
                .id(entity.getId())
                .transactionId(entity.getTransactionId())
                .actorType(entity.getActorType())
                .actorName(entity.getActorName())
                .previousStatus(entity.getPreviousStatus())
                .newStatus(entity.getNewStatus())
                .reason(entity.getReason())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
