package com.ctis.payments.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Input of the interactive initiation flow.
 */
@Value
@Builder
public class InitiatePaymentCommand {

    String clientId;
    BigDecimal amount;
    String currency;
    GatewayType gatewayType;
    Map<String, String> metadata;

    /** Optional caller-chosen reference; repeating it returns the existing transaction. */
    String transactionReference;

    String initiatedBy;
}
