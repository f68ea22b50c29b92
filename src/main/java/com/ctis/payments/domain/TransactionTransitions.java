package com.ctis.payments.domain;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * The transaction state machine as one table: current state to the set of states it may
 * move to. Every status change in the service is validated against {@link #isLegal}.
 */
public final class TransactionTransitions {

    private static final Map<TransactionStatus, Set<TransactionStatus>> LEGAL_TARGETS;

    static {
        Map<TransactionStatus, Set<TransactionStatus>> table = new EnumMap<>(TransactionStatus.class);
        table.put(TransactionStatus.INITIATED, EnumSet.of(
                TransactionStatus.PENDING,
                TransactionStatus.PROCESSING,
                TransactionStatus.EXPIRED));
        table.put(TransactionStatus.PENDING, EnumSet.of(
                TransactionStatus.PROCESSING,
                TransactionStatus.COMPLETED,
                TransactionStatus.FAILED,
                TransactionStatus.CANCELLED,
                TransactionStatus.EXPIRED));
        table.put(TransactionStatus.PROCESSING, EnumSet.of(
                TransactionStatus.COMPLETED,
                TransactionStatus.FAILED,
                TransactionStatus.CANCELLED,
                TransactionStatus.EXPIRED));
        for (TransactionStatus status : TransactionStatus.values()) {
            if (status.isTerminal()) {
                table.put(status, EnumSet.noneOf(TransactionStatus.class));
            }
        }
        table.replaceAll((from, targets) -> Collections.unmodifiableSet(targets));
        LEGAL_TARGETS = Collections.unmodifiableMap(table);
    }

    private TransactionTransitions() {
    }

    public static boolean isLegal(TransactionStatus from, TransactionStatus to) {
        if (from == null || to == null) {
            return false;
        }
        return LEGAL_TARGETS.get(from).contains(to);
    }

    public static Set<TransactionStatus> legalTargets(TransactionStatus from) {
        return LEGAL_TARGETS.get(from);
    }
}
