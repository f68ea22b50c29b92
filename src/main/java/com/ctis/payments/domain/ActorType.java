package com.ctis.payments.domain;

/**
 * Who caused a status change. Recorded on every audit entry.
 */
public enum ActorType {
    USER,
    WEBHOOK,
    SCHEDULER
}
