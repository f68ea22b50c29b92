package com.ctis.payments.webhook;

/**
 * What an accepted callback did. Every outcome is acknowledged to the provider.
 */
public enum WebhookOutcome {
    /** The transaction moved to the reported status. */
    APPLIED,
    /** The same status was already delivered by a webhook. */
    DUPLICATE,
    /** The transaction is terminal, already in the reported status, or cannot move there. */
    IGNORED
}
