package com.ctis.payments.messaging;

import com.ctis.payments.domain.PaymentTransaction;

/**
 * Tells the rest of the practice system that a transaction has finished.
 * Fire-and-forget: implementations must not block the caller on delivery.
 */
public interface PaymentNotificationDispatcher {

    void onTerminal(PaymentTransaction transaction);
}
