package com.ctis.payments.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Accepts every non-blank client id. For local runs and tests without a client service.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "payment.clients.mode", havingValue = "trust")
public class TrustingClientDirectory implements ClientDirectory {

    public TrustingClientDirectory() {
        log.warn("Client existence checks are disabled (payment.clients.mode=trust)");
    }

    @Override
    public boolean exists(String clientId) {
        return clientId != null && !clientId.isBlank();
    }
}
