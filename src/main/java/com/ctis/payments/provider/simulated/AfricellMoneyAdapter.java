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
import java.util.Locale;

/**
 * Africell Money wallet. Callbacks carry a lowercase hex HMAC-SHA1 signature.
 */
@Component
@ConditionalOnProperty(name = "payment.providers.simulation.enabled", havingValue = "true", matchIfMissing = true)
public class AfricellMoneyAdapter extends SimulatedProviderAdapter {

    public AfricellMoneyAdapter(ObjectMapper objectMapper, Clock clock, ProviderSimulationProperties properties) {
        super(objectMapper, clock, properties);
    }

    @Override
    public GatewayType getGatewayType() {
        return GatewayType.AFRICELL_MONEY;
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
        if (signature == null) {
            return false;
        }
        String expected = WebhookSignatures.hmacHex(WebhookSignatures.HMAC_SHA1, secret, rawPayload);
        return WebhookSignatures.constantTimeEquals(expected, signature.trim().toLowerCase(Locale.ROOT));
    }

    @Override
    protected String referencePrefix() {
        return "AFM";
    }

    @Override
    protected String pendingCode() {
        return "PROCESSING";
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
        return "reference";
    }

    @Override
    protected String statusField() {
        return "status";
    }
}
