package com.ctis.payments.provider.simulated;

import com.ctis.payments.config.ProviderSimulationProperties;
import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.ProviderStatus;
import com.ctis.payments.provider.WebhookSignatures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Card / bank gateway that cannot be polled: outcomes only arrive as webhooks.
 */
@Component
@ConditionalOnProperty(name = "payment.providers.simulation.enabled", havingValue = "true", matchIfMissing = true)
public class GenericGatewayAdapter extends SimulatedProviderAdapter {

    public GenericGatewayAdapter(ObjectMapper objectMapper, Clock clock, ProviderSimulationProperties properties) {
        super(objectMapper, clock, properties);
    }

    @Override
    public GatewayType getGatewayType() {
        return GatewayType.GENERIC_GATEWAY;
    }

    @Override
    public boolean supportsActiveQuery() {
        return false;
    }

    @Override
    public ProviderStatus checkStatus(String externalReference) {
        return ProviderStatus.unreachable("Generic gateway reports outcomes through webhooks only");
    }

    @Override
    public boolean verifySignature(String rawPayload, String signature, String secret) {
        String expected = WebhookSignatures.hmacHex(WebhookSignatures.HMAC_SHA256, secret, rawPayload);
        return WebhookSignatures.constantTimeEquals(expected, WebhookSignatures.stripPrefix(signature));
    }

    @Override
    protected String referencePrefix() {
        return "GW";
    }

    @Override
    protected String pendingCode() {
        return "PENDING";
    }

    @Override
    protected String successCode() {
        return "COMPLETED";
    }

    @Override
    protected String declineCode() {
        return "FAILED";
    }

    @Override
    protected String referenceField() {
        return "externalReference";
    }

    @Override
    protected String statusField() {
        return "status";
    }
}
