package com.ctis.payments.api;

import com.ctis.payments.domain.TransactionStatus;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CancelResponseDto {

    Long transactionId;
    /** False when the transaction was already terminal. */
    boolean cancelled;
    TransactionStatus status;
}
