package com.ctis.payments.exception;

/**
 * Another actor kept winning the version race and the bounded retry budget ran out.
 * Transient: callers may retry.
 */
public class ConcurrencyConflictException extends RuntimeException {

    public ConcurrencyConflictException(Long transactionId, int attempts, Throwable cause) {
        super("Transaction " + transactionId + " was modified concurrently; gave up after " + attempts + " attempts", cause);
    }
}
