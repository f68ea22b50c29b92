package com.ctis.payments.reconciliation;

import java.util.Optional;

/**
 * Single-runner lease for the reconciliation sweep.
 */
public interface ReconciliationLock {

    /**
     * @return the holder token when the lease was taken, empty when someone else holds it
     */
    Optional<String> tryAcquire();

    /**
     * Releases the lease if {@code token} still owns it.
     */
    void release(String token);
}
