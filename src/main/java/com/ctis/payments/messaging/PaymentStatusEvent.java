package com.ctis.payments.messaging;

import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.TransactionStatus;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published when a transaction reaches a terminal state. Keyed by transaction
 * reference so consumers see one payment's events in order.
 */
@Value
@Builder
@Jacksonized
public class PaymentStatusEvent {

    String eventId;
    Long transactionId;
    String transactionReference;
    String externalReference;
    String clientId;
    GatewayType gatewayType;
    TransactionStatus status;
    BigDecimal amount;
    String currency;
    String message;
    Instant occurredAt;
}
