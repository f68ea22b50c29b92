package com.ctis.payments.provider.simulated;

import com.ctis.payments.config.ProviderSimulationProperties;
import com.ctis.payments.domain.DispatchResult;
import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.provider.WebhookSignatures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Orange Money wallet. Supports push prompts and status polling; callbacks are signed
 * with HMAC-SHA256, Base64 encoded.
 */
@Component
@ConditionalOnProperty(name = "payment.providers.simulation.enabled", havingValue = "true", matchIfMissing = true)
public class OrangeMoneyAdapter extends SimulatedProviderAdapter {

    public OrangeMoneyAdapter(ObjectMapper objectMapper, Clock clock, ProviderSimulationProperties properties) {
        super(objectMapper, clock, properties);
    }

    @Override
    public GatewayType getGatewayType() {
        return GatewayType.ORANGE_MONEY;
    }

    @Override
    public boolean supportsActiveQuery() {
        return true;
    }

    @Override
    public boolean supportsConfirmationPrompt() {
        return true;
    }

    @Override
    public DispatchResult requestConfirmation(PaymentTransaction transaction) {
        return dispatch(transaction);
    }

    @Override
    public boolean verifySignature(String rawPayload, String signature, String secret) {
        String expected = WebhookSignatures.hmacBase64(WebhookSignatures.HMAC_SHA256, secret, rawPayload);
        return WebhookSignatures.constantTimeEquals(expected, WebhookSignatures.stripPrefix(signature));
    }

    @Override
    protected String referencePrefix() {
        return "OM";
    }

    @Override
    protected String pendingCode() {
        return "PENDING";
    }

    @Override
    protected String successCode() {
        return "SUCCESS";
    }

    @Override
    protected String declineCode() {
        return "FAILED";
    }

    @Override
    protected String referenceField() {
        return "transactionId";
    }

    @Override
    protected String statusField() {
        return "status";
    }
}
