package com.ctis.payments.provider.simulated;

import com.ctis.payments.config.ProviderSimulationProperties;
import com.ctis.payments.domain.DispatchResult;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.ProviderStatus;
import com.ctis.payments.domain.WebhookNotification;
import com.ctis.payments.provider.ProviderAdapter;
import com.ctis.payments.provider.ProviderStatusCodes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory stand-in for a provider rail. Dispatched payments report the family's
 * pending code until {@code settleAfter} has passed, then its success code, or its
 * decline code for amounts at or above the decline threshold. Subclasses supply the
 * family's vocabulary, payload field names and signature scheme.
 * <p>
 * Payments are keyed by our transaction reference, so dispatching the same transaction
 * again returns the payment already created. Entries older than {@code retention} are
 * dropped on the next dispatch.
 */
@Slf4j
public abstract class SimulatedProviderAdapter implements ProviderAdapter {

    private final Map<String, SimulatedPayment> paymentsByTransaction = new ConcurrentHashMap<>();
    private final Map<String, SimulatedPayment> paymentsByReference = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ProviderSimulationProperties properties;

    protected SimulatedProviderAdapter(ObjectMapper objectMapper, Clock clock, ProviderSimulationProperties properties) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.properties = properties;
    }

    /** Prefix of the references this rail hands out. */
    protected abstract String referencePrefix();

    protected abstract String pendingCode();

    protected abstract String successCode();

    protected abstract String declineCode();

    /** JSON field carrying the provider reference in callbacks. */
    protected abstract String referenceField();

    /** JSON field carrying the status code in callbacks. */
    protected abstract String statusField();

    @Override
    public DispatchResult dispatch(PaymentTransaction transaction) {
        Instant now = Instant.now(clock);
        evictExpired(now);
        SimulatedPayment payment = paymentsByTransaction.computeIfAbsent(transaction.getTransactionReference(),
                key -> {
                    String reference = transaction.getExternalReference() != null
                            ? transaction.getExternalReference()
                            : newReference();
                    SimulatedPayment created = new SimulatedPayment(reference, transaction.getAmount(), now);
                    paymentsByReference.put(reference, created);
                    return created;
                });
        log.debug("{} dispatched transactionReference={} externalReference={} amount={}",
                getAdapterName(), transaction.getTransactionReference(), payment.getExternalReference(),
                transaction.getAmount());
        return DispatchResult.builder()
                .externalReference(payment.getExternalReference())
                .message("Accepted by " + getGatewayType())
                .build();
    }

    @Override
    public ProviderStatus checkStatus(String externalReference) {
        SimulatedPayment payment = paymentsByReference.get(externalReference);
        if (payment == null) {
            return ProviderStatus.unreachable(getGatewayType() + " has no record of " + externalReference);
        }
        Instant settlesAt = payment.getDispatchedAt().plus(properties.getSettleAfter());
        String code;
        if (Instant.now(clock).isBefore(settlesAt)) {
            code = pendingCode();
        } else if (payment.getAmount().compareTo(properties.getDeclineThreshold()) >= 0) {
            code = declineCode();
        } else {
            code = successCode();
        }
        return ProviderStatus.of(ProviderStatusCodes.map(getGatewayType(), code), "Provider reported " + code);
    }

    @Override
    public WebhookNotification parseNotification(String rawPayload) {
        try {
            JsonNode root = objectMapper.readTree(rawPayload);
            if (root == null || !root.isObject()) {
                throw new IllegalArgumentException("Callback body is not a JSON object");
            }
            return new WebhookNotification(text(root, referenceField()), text(root, statusField()));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Callback body is not valid JSON", e);
        }
    }

    private void evictExpired(Instant now) {
        Instant cutoff = now.minus(properties.getRetention());
        paymentsByTransaction.values().removeIf(payment -> payment.getDispatchedAt().isBefore(cutoff));
        paymentsByReference.values().removeIf(payment -> payment.getDispatchedAt().isBefore(cutoff));
    }

    protected String newReference() {
        return referencePrefix() + "-" + UUID.randomUUID();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            throw new IllegalArgumentException("Callback body is missing " + field);
        }
        return value.asText();
    }

    @Value
    private static class SimulatedPayment {
        String externalReference;
        BigDecimal amount;
        Instant dispatchedAt;
    }
}
