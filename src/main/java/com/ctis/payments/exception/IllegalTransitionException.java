package com.ctis.payments.exception;

import com.ctis.payments.domain.TransactionStatus;
import lombok.Getter;

/**
 * The requested status change is not an edge of the transition table. Not raised for
 * terminal rows: those are silent no-ops.
 */
@Getter
public class IllegalTransitionException extends RuntimeException {

    private final Long transactionId;
    private final TransactionStatus from;
    private final TransactionStatus to;

    public IllegalTransitionException(Long transactionId, TransactionStatus from, TransactionStatus to) {
        super("Transaction " + transactionId + " cannot move from " + from + " to " + to);
        this.transactionId = transactionId;
        this.from = from;
        this.to = to;
    }
}
