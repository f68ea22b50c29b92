package com.ctis.payments.exception;

/**
 * Base for unknown clients and transactions. Handler returns HTTP 404.
 */
public abstract class NotFoundException extends RuntimeException {

    protected NotFoundException(String message) {
        super(message);
    }
}
