package com.ctis.payments.exception;

public class ClientNotFoundException extends NotFoundException {

    public ClientNotFoundException(String clientId) {
        super("Client " + clientId + " not found");
    }
}
