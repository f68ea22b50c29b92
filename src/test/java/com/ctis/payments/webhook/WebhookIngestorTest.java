package com.ctis.payments.webhook;

import com.ctis.payments.config.ProviderSimulationProperties;
import com.ctis.payments.config.WebhookProperties;
import com.ctis.payments.core.PaymentGatewayService;
import com.ctis.payments.domain.Actor;
import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.exception.PaymentValidationException;
import com.ctis.payments.exception.TransactionNotFoundException;
import com.ctis.payments.exception.UnmappedStatusCodeException;
import com.ctis.payments.exception.WebhookSignatureException;
import com.ctis.payments.persistence.service.TransactionStore;
import com.ctis.payments.provider.ProviderAdapter;
import com.ctis.payments.provider.ProviderAdapterRegistry;
import com.ctis.payments.provider.WebhookSignatures;
import com.ctis.payments.provider.simulated.SaloneSwitchAdapter;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WebhookIngestorTest {

    private static final String SECRET = "salone-secret";

    @Mock
    private ProviderAdapterRegistry providers;
    @Mock
    private TransactionStore store;
    @Mock
    private PaymentGatewayService gatewayService;

    private ExecutorService executor;
    private WebhookIngestor ingestor;

    @BeforeEach
    void setUp() {
        SaloneSwitchAdapter adapter = new SaloneSwitchAdapter(new ObjectMapper(), Clock.systemUTC(),
                new ProviderSimulationProperties());
        lenient().when(providers.adapterFor(GatewayType.SALONE_SWITCH)).thenReturn(adapter);

        WebhookProperties webhookProperties = new WebhookProperties();
        webhookProperties.getSecrets().put(GatewayType.SALONE_SWITCH, SECRET);
        executor = Executors.newCachedThreadPool();
        TimeLimiterRegistry timeLimiterRegistry = TimeLimiterRegistry.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(200))
                .build());
        ingestor = new WebhookIngestor(providers, webhookProperties, store, gatewayService, timeLimiterRegistry, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void validCallbackUpdatesStatusAsWebhookActor() {
        when(store.findByExternalReference(GatewayType.SALONE_SWITCH, "E2E-1"))
                .thenReturn(Optional.of(transaction(TransactionStatus.PROCESSING)));
        when(gatewayService.updateStatus(eq(5L), eq(TransactionStatus.COMPLETED), anyString(),
                eq(Actor.webhook(GatewayType.SALONE_SWITCH)))).thenReturn(true);

        String body = body("E2E-1", "ACSC");
        WebhookOutcome outcome = ingestor.ingest(GatewayType.SALONE_SWITCH, body, sign(body));

        assertThat(outcome).isEqualTo(WebhookOutcome.APPLIED);
    }

    @Test
    void badSignatureIsRejectedBeforeAnyLookup() {
        String body = body("E2E-1", "ACSC");

        assertThatThrownBy(() -> ingestor.ingest(GatewayType.SALONE_SWITCH, body, "sha256=deadbeef"))
                .isInstanceOf(WebhookSignatureException.class);
        verifyNoInteractions(store, gatewayService);
    }

    @Test
    void missingSignatureOrSecretIsRejected() {
        String body = body("E2E-1", "ACSC");
        assertThatThrownBy(() -> ingestor.ingest(GatewayType.SALONE_SWITCH, body, null))
                .isInstanceOf(WebhookSignatureException.class);

        ProviderAdapter orange = mock(ProviderAdapter.class);
        when(orange.getGatewayType()).thenReturn(GatewayType.ORANGE_MONEY);
        when(providers.adapterFor(GatewayType.ORANGE_MONEY)).thenReturn(orange);
        assertThatThrownBy(() -> ingestor.ingest(GatewayType.ORANGE_MONEY, body, "sig"))
                .isInstanceOf(WebhookSignatureException.class)
                .hasMessageContaining("No webhook secret");
    }

    @Test
    void slowVerificationTimesOutAsRejection() {
        ProviderAdapter slow = mock(ProviderAdapter.class);
        when(slow.getGatewayType()).thenReturn(GatewayType.SALONE_SWITCH);
        when(slow.verifySignature(anyString(), anyString(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return true;
        });
        when(providers.adapterFor(GatewayType.SALONE_SWITCH)).thenReturn(slow);

        assertThatThrownBy(() -> ingestor.ingest(GatewayType.SALONE_SWITCH, "{}", "sig"))
                .isInstanceOf(WebhookSignatureException.class)
                .hasMessageContaining("timed out");
        verifyNoInteractions(store, gatewayService);
    }

    @Test
    void unmappedCodeIsAnError() {
        String body = body("E2E-1", "ACCP");

        assertThatThrownBy(() -> ingestor.ingest(GatewayType.SALONE_SWITCH, body, sign(body)))
                .isInstanceOf(UnmappedStatusCodeException.class);
        verifyNoInteractions(gatewayService);
    }

    @Test
    void unparseableBodyIsValidationError() {
        String body = "{\"endToEndId\":\"E2E-1\"}";

        assertThatThrownBy(() -> ingestor.ingest(GatewayType.SALONE_SWITCH, body, sign(body)))
                .isInstanceOf(PaymentValidationException.class);
    }

    @Test
    void unknownExternalReferenceIsNotFound() {
        when(store.findByExternalReference(GatewayType.SALONE_SWITCH, "E2E-404")).thenReturn(Optional.empty());
        String body = body("E2E-404", "ACSC");

        assertThatThrownBy(() -> ingestor.ingest(GatewayType.SALONE_SWITCH, body, sign(body)))
                .isInstanceOf(TransactionNotFoundException.class);
    }

    @Test
    void redeliveryIsAcknowledgedWithoutSideEffects() {
        when(store.findByExternalReference(GatewayType.SALONE_SWITCH, "E2E-1"))
                .thenReturn(Optional.of(transaction(TransactionStatus.COMPLETED)));
        when(store.hasWebhookTransition(5L, TransactionStatus.COMPLETED)).thenReturn(true);
        String body = body("E2E-1", "ACSC");

        assertThat(ingestor.ingest(GatewayType.SALONE_SWITCH, body, sign(body))).isEqualTo(WebhookOutcome.DUPLICATE);
        verifyNoInteractions(gatewayService);
    }

    @Test
    void lateCallbackForTerminalRowIsIgnored() {
        when(store.findByExternalReference(GatewayType.SALONE_SWITCH, "E2E-1"))
                .thenReturn(Optional.of(transaction(TransactionStatus.EXPIRED)));
        String body = body("E2E-1", "ACSC");

        assertThat(ingestor.ingest(GatewayType.SALONE_SWITCH, body, sign(body))).isEqualTo(WebhookOutcome.IGNORED);
        verifyNoInteractions(gatewayService);
    }

    @Test
    void backwardsStatusIsAcknowledgedWithoutChange() {
        when(store.findByExternalReference(GatewayType.SALONE_SWITCH, "E2E-1"))
                .thenReturn(Optional.of(transaction(TransactionStatus.PROCESSING)));
        String body = body("E2E-1", "PDNG");

        assertThat(ingestor.ingest(GatewayType.SALONE_SWITCH, body, sign(body))).isEqualTo(WebhookOutcome.IGNORED);
        verify(gatewayService, org.mockito.Mockito.never()).updateStatus(any(), any(), anyString(), any());
    }

    private static String body(String endToEndId, String status) {
        return "{\"endToEndId\":\"" + endToEndId + "\",\"txSts\":\"" + status + "\"}";
    }

    private static String sign(String body) {
        return "sha256=" + WebhookSignatures.hmacHex(WebhookSignatures.HMAC_SHA256, SECRET, body);
    }

    private static PaymentTransaction transaction(TransactionStatus status) {
        return PaymentTransaction.builder()
                .id(5L)
                .transactionReference("PAY-5")
                .externalReference("E2E-1")
                .clientId("client-1")
                .amount(new BigDecimal("50.00"))
                .currency("SLE")
                .gatewayType(GatewayType.SALONE_SWITCH)
                .status(status)
                .version(2L)
                .build();
    }
}
