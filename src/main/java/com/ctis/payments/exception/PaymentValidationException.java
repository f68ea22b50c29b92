package com.ctis.payments.exception;

/**
 * Malformed or out-of-range input, rejected before any row is written.
 */
public class PaymentValidationException extends IllegalArgumentException {

    public PaymentValidationException(String message) {
        super(message);
    }
}
