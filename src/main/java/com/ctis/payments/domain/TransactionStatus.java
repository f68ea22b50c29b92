package com.ctis.payments.domain;

/**
 * Lifecycle states of a gateway transaction. Legal moves between them are defined in
 * {@link TransactionTransitions}; the four terminal states are kept distinct because
 * receipts, retries and client messaging treat each differently.
 */
public enum TransactionStatus {
    /** Row created, nothing sent to the provider yet. */
    INITIATED(false),
    /** Confirmation prompt delivered to the payer, waiting for them. */
    PENDING(false),
    /** Provider accepted the payment and is working on it. */
    PROCESSING(false),
    COMPLETED(true),
    FAILED(true),
    CANCELLED(true),
    /** Session window elapsed before a result arrived. */
    EXPIRED(true);

    private final boolean terminal;

    TransactionStatus(boolean terminal) {
        this.terminal = terminal;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
