package com.ctis.payments.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Normalized answer to "what does the provider think happened?". Either a
 * {@link TransactionStatus} or the distinguished unreachable result, which is transient
 * and must never be read as a failure.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProviderStatus {

    TransactionStatus status;
    boolean reachable;
    String message;

    public static ProviderStatus of(TransactionStatus status, String message) {
        if (status == null) {
            throw new IllegalArgumentException("status is required for a reachable provider result");
        }
        return new ProviderStatus(status, true, message);
    }

    public static ProviderStatus of(TransactionStatus status) {
        return of(status, null);
    }

    public static ProviderStatus unreachable(String message) {
        return new ProviderStatus(null, false, message);
    }

    /** True only for a reachable answer naming a terminal state. */
    public boolean isDefinitiveTerminal() {
        return reachable && status.isTerminal();
    }
}
