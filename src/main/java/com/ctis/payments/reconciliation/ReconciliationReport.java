package com.ctis.payments.reconciliation;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of one sweep. {@code skipped} is set when another runner held the lock.
 */
@Value
@Builder
public class ReconciliationReport {

    Instant startedAt;
    int inspected;
    int updated;
    int errors;
    boolean cancelled;
    boolean skipped;

    public static ReconciliationReport skipped(Instant startedAt) {
        return ReconciliationReport.builder().startedAt(startedAt).skipped(true).build();
    }
}
