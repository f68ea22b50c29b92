package com.ctis.payments.exception;

/**
 * The session window of the transaction has elapsed; it can no longer be dispatched.
 */
public class TransactionExpiredException extends RuntimeException {

    public TransactionExpiredException(Long transactionId) {
        super("Transaction " + transactionId + " has expired");
    }
}
