package com.ctis.payments.client;

/**
 * The practice's client registry, consulted before a transaction is created.
 */
public interface ClientDirectory {

    boolean exists(String clientId);
}
