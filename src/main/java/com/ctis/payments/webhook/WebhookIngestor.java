package com.ctis.payments.webhook;

import com.ctis.payments.config.PaymentGatewayConfig;
import com.ctis.payments.config.WebhookProperties;
import com.ctis.payments.core.PaymentGatewayService;
import com.ctis.payments.domain.Actor;
import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.domain.TransactionTransitions;
import com.ctis.payments.domain.WebhookNotification;
import com.ctis.payments.exception.IllegalTransitionException;
import com.ctis.payments.exception.PaymentValidationException;
import com.ctis.payments.exception.TransactionNotFoundException;
import com.ctis.payments.exception.WebhookSignatureException;
import com.ctis.payments.persistence.service.TransactionStore;
import com.ctis.payments.provider.ProviderAdapter;
import com.ctis.payments.provider.ProviderAdapterRegistry;
import com.ctis.payments.provider.ProviderStatusCodes;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Turns authenticated provider callbacks into status updates. Providers redeliver
 * freely, so a callback that changes nothing is still a success.
 */
@Slf4j
@Service
public class WebhookIngestor {

    static final String TIME_LIMITER = "webhook-verification";

    private final ProviderAdapterRegistry providers;
    private final WebhookProperties webhookProperties;
    private final TransactionStore store;
    private final PaymentGatewayService gatewayService;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService executor;

    public WebhookIngestor(ProviderAdapterRegistry providers,
                           WebhookProperties webhookProperties,
                           TransactionStore store,
                           PaymentGatewayService gatewayService,
                           TimeLimiterRegistry timeLimiterRegistry,
                           @Qualifier(PaymentGatewayConfig.PROVIDER_CALL_EXECUTOR) ExecutorService executor) {
        this.providers = providers;
        this.webhookProperties = webhookProperties;
        this.store = store;
        this.gatewayService = gatewayService;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.executor = executor;
    }

    /**
     * @throws WebhookSignatureException when no secret is configured or the signature does not match
     * @throws PaymentValidationException when the body cannot be parsed
     * @throws com.ctis.payments.exception.UnmappedStatusCodeException when the status code is unknown
     * @throws TransactionNotFoundException when no transaction carries the external reference
     */
    public WebhookOutcome ingest(GatewayType gatewayType, String rawPayload, String signature) {
        ProviderAdapter adapter = providers.adapterFor(gatewayType);
        verify(adapter, rawPayload, signature);

        WebhookNotification notification;
        try {
            notification = adapter.parseNotification(rawPayload);
        } catch (IllegalArgumentException e) {
            throw new PaymentValidationException(gatewayType + " callback rejected: " + e.getMessage());
        }
        TransactionStatus reported = ProviderStatusCodes.map(gatewayType, notification.getResultCode());

        PaymentTransaction transaction = store.findByExternalReference(gatewayType, notification.getExternalReference())
                .orElseThrow(() -> new TransactionNotFoundException(
                        "No " + gatewayType + " transaction with external reference " + notification.getExternalReference()));
        Long id = transaction.getId();

        if (store.hasWebhookTransition(id, reported)) {
            log.info("Duplicate webhook for transaction {}: status {} already applied", id, reported);
            return WebhookOutcome.DUPLICATE;
        }
        if (transaction.isTerminal()) {
            log.info("Webhook for terminal transaction {} ({}) acknowledged: reported={}",
                    id, transaction.getStatus(), reported);
            return WebhookOutcome.IGNORED;
        }
        if (transaction.getStatus() == reported || !TransactionTransitions.isLegal(transaction.getStatus(), reported)) {
            log.info("Webhook for transaction {} reports {} while row is {}; acknowledged without change",
                    id, reported, transaction.getStatus());
            return WebhookOutcome.IGNORED;
        }

        try {
            boolean applied = gatewayService.updateStatus(id, reported,
                    gatewayType + " reported " + notification.getResultCode(), Actor.webhook(gatewayType));
            return applied ? WebhookOutcome.APPLIED : WebhookOutcome.IGNORED;
        } catch (IllegalTransitionException e) {
            // the row moved on between our read and the update
            log.info("Webhook for transaction {} no longer applicable: {}", id, e.getMessage());
            return WebhookOutcome.IGNORED;
        }
    }

    private void verify(ProviderAdapter adapter, String rawPayload, String signature) {
        GatewayType gatewayType = adapter.getGatewayType();
        String secret = webhookProperties.secretFor(gatewayType)
                .orElseThrow(() -> new WebhookSignatureException("No webhook secret configured for " + gatewayType));
        if (signature == null || signature.isBlank()) {
            throw new WebhookSignatureException("Missing signature on " + gatewayType + " callback");
        }
        if (rawPayload == null) {
            throw new WebhookSignatureException("Empty " + gatewayType + " callback");
        }

        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(TIME_LIMITER);
        boolean valid;
        try {
            valid = timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(
                    () -> adapter.verifySignature(rawPayload, signature, secret), executor));
        } catch (TimeoutException e) {
            log.warn("Signature verification timed out for {} callback", gatewayType);
            throw new WebhookSignatureException("Signature verification timed out");
        } catch (Exception e) {
            log.warn("Signature verification failed for {} callback", gatewayType, e);
            throw new WebhookSignatureException("Signature verification failed");
        }
        if (!valid) {
            log.warn("Invalid signature on {} callback", gatewayType);
            throw new WebhookSignatureException("Invalid signature");
        }
    }
}
