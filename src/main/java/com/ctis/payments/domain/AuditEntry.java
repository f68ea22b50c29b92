package com.ctis.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One recorded status change of a transaction.
 */
@Value
@Builder
public class AuditEntry {

    Long id;
    Long transactionId;
    ActorType actorType;
    String actorName;
    TransactionStatus previousStatus;
    TransactionStatus newStatus;
    String reason;
    Instant createdAt;
}
