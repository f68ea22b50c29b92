package com.ctis.payments.provider;

import com.ctis.payments.domain.DispatchResult;
import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.ProviderStatus;
import com.ctis.payments.domain.WebhookNotification;

/**
 * What every provider family implements. Takes our transaction, talks to the rail, and
 * gives back normalized results. Adapters never write to the transaction store; the
 * gateway service acts on what they return.
 * <p>
 * Calls are wrapped by {@link ProviderAdapterRegistry} with a circuit breaker and a time
 * limiter, so implementations may block and may throw on transport errors.
 */
public interface ProviderAdapter {

    GatewayType getGatewayType();

    /**
     * Name used for the adapter's circuit breaker and in logs.
     */
    default String getAdapterName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Whether {@link #checkStatus} asks the provider. Families that only report through
     * webhooks return false and are refreshed through the gateway service instead.
     */
    boolean supportsActiveQuery();

    /**
     * Whether the rail can push a confirmation prompt (e.g. a wallet PIN request) before
     * the payment is processed.
     */
    default boolean supportsConfirmationPrompt() {
        return false;
    }

    /**
     * Sends the payment to the provider. Must be idempotent on the transaction
     * reference: a repeated dispatch of the same transaction returns the payment the
     * provider already holds rather than creating a second one.
     *
     * @return the provider's reference for it (never null)
     */
    DispatchResult dispatch(PaymentTransaction transaction);

    /**
     * Pushes a confirmation prompt to the payer.
     */
    default DispatchResult requestConfirmation(PaymentTransaction transaction) {
        throw new UnsupportedOperationException(getGatewayType() + " does not support confirmation prompts");
    }

    /**
     * Current status of a dispatched payment, mapped through {@link ProviderStatusCodes}.
     */
    ProviderStatus checkStatus(String externalReference);

    /**
     * Extracts the correlation fields from a raw callback body.
     *
     * @throws IllegalArgumentException when the body cannot be read
     */
    WebhookNotification parseNotification(String rawPayload);

    /**
     * Checks a callback signature against the shared secret.
     */
    boolean verifySignature(String rawPayload, String signature, String secret);
}
