package com.ctis.payments.exception;

public class TransactionNotFoundException extends NotFoundException {

    public TransactionNotFoundException(String message) {
        super(message);
    }

    public static TransactionNotFoundException byId(Long id) {
        return new TransactionNotFoundException("Transaction " + id + " not found");
    }

    public static TransactionNotFoundException byReference(String reference) {
        return new TransactionNotFoundException("Transaction with reference " + reference + " not found");
    }
}
