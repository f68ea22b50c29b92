package com.ctis.payments.provider.simulated;

import com.ctis.payments.config.ProviderSimulationProperties;
import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.provider.WebhookSignatures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * National payment switch. Reports ISO 20022 pain.002 status codes (PDNG, ACSC, RJCT)
 * keyed by end-to-end id, and answers status queries.
 */
@Component
@ConditionalOnProperty(name = "payment.providers.simulation.enabled", havingValue = "true", matchIfMissing = true)
public class SaloneSwitchAdapter extends SimulatedProviderAdapter {

    public SaloneSwitchAdapter(ObjectMapper objectMapper, Clock clock, ProviderSimulationProperties properties) {
        super(objectMapper, clock, properties);
    }

    @Override
    public GatewayType getGatewayType() {
        return GatewayType.SALONE_SWITCH;
    }

    @Override
    public boolean supportsActiveQuery() {
        return true;
    }

    @Override
    public boolean verifySignature(String rawPayload, String signature, String secret) {
        String expected = WebhookSignatures.hmacHex(WebhookSignatures.HMAC_SHA256, secret, rawPayload);
        return WebhookSignatures.constantTimeEquals(expected, WebhookSignatures.stripPrefix(signature));
    }

    @Override
    protected String referencePrefix() {
        return "E2E";
    }

    @Override
    protected String pendingCode() {
        return "PDNG";
    }

    @Override
    protected String successCode() {
        return "ACSC";
    }

    @Override
    protected String declineCode() {
        return "RJCT";
    }

    @Override
    protected String referenceField() {
        return "endToEndId";
    }

    @Override
    protected String statusField() {
        return "txSts";
    }
}
