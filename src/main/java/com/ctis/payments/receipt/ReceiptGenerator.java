package com.ctis.payments.receipt;

import com.ctis.payments.domain.PaymentTransaction;

/**
 * Issues the receipt for a completed transaction. Issuing twice for the same
 * transaction returns the first receipt number.
 */
public interface ReceiptGenerator {

    String issue(PaymentTransaction transaction);
}
