package com.ctis.payments.exception;

/**
 * Thrown when a provider could not be reached (timeout, open circuit, transport error).
 * Handler returns HTTP 503 so the client knows to retry later. Never turns a
 * transaction into Failed by itself.
 */
public class ProviderUnavailableException extends RuntimeException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
