package com.ctis.payments.core;

import com.ctis.payments.client.TrustingClientDirectory;
import com.ctis.payments.config.GatewayProperties;
import com.ctis.payments.config.ProviderSimulationProperties;
import com.ctis.payments.config.ReconciliationProperties;
import com.ctis.payments.config.WebhookProperties;
import com.ctis.payments.domain.Actor;
import com.ctis.payments.domain.AuditEntry;
import com.ctis.payments.domain.DispatchResult;
import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.InitiatePaymentCommand;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.persistence.repository.PaymentReceiptRepository;
import com.ctis.payments.persistence.repository.PaymentTransactionRepository;
import com.ctis.payments.persistence.repository.TransactionAuditRepository;
import com.ctis.payments.persistence.service.TransactionStore;
import com.ctis.payments.provider.ProviderAdapterRegistry;
import com.ctis.payments.provider.WebhookSignatures;
import com.ctis.payments.provider.simulated.OrangeMoneyAdapter;
import com.ctis.payments.provider.simulated.SaloneSwitchAdapter;
import com.ctis.payments.receipt.PersistentReceiptGenerator;
import com.ctis.payments.reconciliation.LocalReconciliationLock;
import com.ctis.payments.reconciliation.PaymentReconciliationJob;
import com.ctis.payments.support.MutableClock;
import com.ctis.payments.webhook.WebhookIngestor;
import com.ctis.payments.webhook.WebhookOutcome;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end lifecycle over a real database: initiation, dispatch, callbacks,
 * reconciliation sweeps and racing updates. Each store call commits on its own, so the
 * test runs outside a test-managed transaction and cleans up after itself.
 */
@DataJpaTest
@Import(TransactionStore.class)
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class PaymentLifecycleScenarioTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");
    private static final String SALONE_SECRET = "salone-scenario-secret";
    private static final Actor CLERK = Actor.user("clerk-1");

    @Autowired
    private TransactionStore store;
    @Autowired
    private PaymentTransactionRepository transactionRepository;
    @Autowired
    private TransactionAuditRepository auditRepository;
    @Autowired
    private PaymentReceiptRepository receiptRepository;

    private final List<PaymentTransaction> notified = Collections.synchronizedList(new ArrayList<>());

    private MutableClock clock;
    private ExecutorService executor;
    private ProviderSimulationProperties simulation;
    private PaymentGatewayService gatewayService;
    private WebhookIngestor webhookIngestor;
    private PaymentReconciliationJob reconciliationJob;
    private CountingSaloneSwitchAdapter saloneAdapter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        executor = Executors.newFixedThreadPool(4);
        simulation = new ProviderSimulationProperties();
        ObjectMapper objectMapper = new ObjectMapper();

        saloneAdapter = new CountingSaloneSwitchAdapter(objectMapper, clock, simulation);
        ProviderAdapterRegistry providers = new ProviderAdapterRegistry(
                List.of(saloneAdapter,
                        new OrangeMoneyAdapter(objectMapper, clock, simulation)),
                CircuitBreakerRegistry.ofDefaults(), TimeLimiterRegistry.ofDefaults(), executor);
        providers.init();

        GatewayProperties gatewayProperties = new GatewayProperties();
        gatewayService = new PaymentGatewayService(store, providers, new TrustingClientDirectory(), notified::add,
                new PersistentReceiptGenerator(receiptRepository, clock), new TransactionReferenceGenerator(clock),
                gatewayProperties, clock);

        WebhookProperties webhookProperties = new WebhookProperties();
        webhookProperties.getSecrets().put(GatewayType.SALONE_SWITCH, SALONE_SECRET);
        webhookIngestor = new WebhookIngestor(providers, webhookProperties, store, gatewayService,
                TimeLimiterRegistry.ofDefaults(), executor);

        reconciliationJob = new PaymentReconciliationJob(store, gatewayService, new LocalReconciliationLock(),
                new ReconciliationProperties(), clock);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        receiptRepository.deleteAll();
        auditRepository.deleteAll();
        transactionRepository.deleteAll();
    }

    @Test
    void initiationOpensASessionWindow() {
        PaymentTransaction transaction = initiate(GatewayType.ORANGE_MONEY, "100");

        assertThat(transaction.getStatus()).isEqualTo(TransactionStatus.INITIATED);
        assertThat(transaction.getExpiresAt()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
        assertThat(transaction.getAmount()).isEqualByComparingTo("100.00");
        assertThat(gatewayService.getAuditTrail(transaction.getId())).hasSize(1);
    }

    @Test
    void settlementCallbackCompletesOnceAndRedeliveryIsHarmless() {
        PaymentTransaction processing = gatewayService.process(initiate(GatewayType.SALONE_SWITCH, "100").getId(), CLERK);
        assertThat(processing.getStatus()).isEqualTo(TransactionStatus.PROCESSING);
        String body = "{\"endToEndId\":\"" + processing.getExternalReference() + "\",\"txSts\":\"ACSC\"}";
        String signature = WebhookSignatures.hmacHex(WebhookSignatures.HMAC_SHA256, SALONE_SECRET, body);

        WebhookOutcome first = webhookIngestor.ingest(GatewayType.SALONE_SWITCH, body, signature);
        WebhookOutcome second = webhookIngestor.ingest(GatewayType.SALONE_SWITCH, body, signature);

        assertThat(first).isEqualTo(WebhookOutcome.APPLIED);
        assertThat(second).isEqualTo(WebhookOutcome.DUPLICATE);
        PaymentTransaction completed = gatewayService.getTransaction(processing.getId());
        assertThat(completed.getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        assertThat(completed.getCompletedAt()).isNotNull();
        assertThat(receiptRepository.countByTransactionId(processing.getId())).isEqualTo(1);
        assertThat(notified).extracting(PaymentTransaction::getId).containsExactly(processing.getId());
    }

    @Test
    void abandonedSessionIsExpiredByTheNextSweep() {
        PaymentTransaction pending = gatewayService.requestConfirmation(
                initiate(GatewayType.ORANGE_MONEY, "100").getId(), CLERK);
        assertThat(pending.getStatus()).isEqualTo(TransactionStatus.PENDING);

        clock.advance(Duration.ofMinutes(10).plusSeconds(1));
        reconciliationJob.runOnce(() -> false);

        PaymentTransaction expired = gatewayService.getTransaction(pending.getId());
        assertThat(expired.getStatus()).isEqualTo(TransactionStatus.EXPIRED);
        List<AuditEntry> trail = gatewayService.getAuditTrail(pending.getId());
        assertThat(trail.get(trail.size() - 1).getActorName()).isEqualTo("payment-reconciliation");
    }

    @Test
    void stuckProcessingIsFailedAfterTheProcessingTimeout() {
        simulation.setSettleAfter(Duration.ofHours(1));
        PaymentTransaction processing = gatewayService.process(initiate(GatewayType.SALONE_SWITCH, "100").getId(), CLERK);

        clock.advance(Duration.ofMinutes(6));
        reconciliationJob.runOnce(() -> false);

        PaymentTransaction failed = gatewayService.getTransaction(processing.getId());
        assertThat(failed.getStatus()).isEqualTo(TransactionStatus.FAILED);
        assertThat(failed.getStatusMessage()).isEqualTo("processing timeout exceeded");
        assertThat(receiptRepository.countByTransactionId(processing.getId())).isZero();
    }

    @Test
    void sweepPullsOutcomeWhenTheCallbackNeverArrives() {
        PaymentTransaction processing = gatewayService.process(initiate(GatewayType.SALONE_SWITCH, "100").getId(), CLERK);

        clock.advance(Duration.ofMinutes(1));
        reconciliationJob.runOnce(() -> false);

        assertThat(gatewayService.getTransaction(processing.getId()).getStatus()).isEqualTo(TransactionStatus.COMPLETED);
        assertThat(receiptRepository.countByTransactionId(processing.getId())).isEqualTo(1);
    }

    @Test
    void racingTerminalUpdatesLeaveExactlyOneOutcome() throws Exception {
        Long id = gatewayService.process(initiate(GatewayType.SALONE_SWITCH, "100").getId(), CLERK).getId();
        CountDownLatch start = new CountDownLatch(1);
        Callable<Boolean> complete = () -> {
            start.await();
            return gatewayService.updateStatus(id, TransactionStatus.COMPLETED, "settled", CLERK);
        };
        Callable<Boolean> fail = () -> {
            start.await();
            return gatewayService.updateStatus(id, TransactionStatus.FAILED, "declined", CLERK);
        };
        ExecutorService racers = Executors.newFixedThreadPool(2);
        try {
            Future<Boolean> a = racers.submit(complete);
            Future<Boolean> b = racers.submit(fail);
            start.countDown();
            int winners = (a.get(10, TimeUnit.SECONDS) ? 1 : 0) + (b.get(10, TimeUnit.SECONDS) ? 1 : 0);
            assertThat(winners).isEqualTo(1);
        } finally {
            racers.shutdownNow();
        }

        PaymentTransaction result = gatewayService.getTransaction(id);
        assertThat(result.isTerminal()).isTrue();
        assertThat(gatewayService.getAuditTrail(id))
                .filteredOn(entry -> entry.getNewStatus().isTerminal())
                .hasSize(1)
                .first()
                .extracting(AuditEntry::getNewStatus)
                .isEqualTo(result.getStatus());
    }

    @Test
    void concurrentProcessCallsCreateOneProviderPayment() throws Exception {
        Long id = initiate(GatewayType.SALONE_SWITCH, "100").getId();
        saloneAdapter.holdDispatchesUntil(new CyclicBarrier(2));
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            Future<PaymentTransaction> a = callers.submit(() -> gatewayService.process(id, CLERK));
            Future<PaymentTransaction> b = callers.submit(() -> gatewayService.process(id, Actor.user("clerk-2")));
            PaymentTransaction first = a.get(10, TimeUnit.SECONDS);
            PaymentTransaction second = b.get(10, TimeUnit.SECONDS);

            assertThat(first.getStatus()).isEqualTo(TransactionStatus.PROCESSING);
            assertThat(second.getStatus()).isEqualTo(TransactionStatus.PROCESSING);
            assertThat(second.getExternalReference()).isEqualTo(first.getExternalReference());
        } finally {
            callers.shutdownNow();
        }

        assertThat(saloneAdapter.paymentsCreated()).isEqualTo(1);
        assertThat(gatewayService.getTransaction(id).getExternalReference()).startsWith("E2E-");
        assertThat(gatewayService.getAuditTrail(id))
                .filteredOn(entry -> entry.getNewStatus() == TransactionStatus.PROCESSING)
                .hasSize(1);
    }

    private PaymentTransaction initiate(GatewayType gatewayType, String amount) {
        return gatewayService.initiate(InitiatePaymentCommand.builder()
                .clientId("client-42")
                .amount(new BigDecimal(amount))
                .gatewayType(gatewayType)
                .initiatedBy("clerk-1")
                .build());
    }

    /**
     * Salone switch rail that counts the payments it creates and can hold dispatches
     * until every caller has arrived.
     */
    static class CountingSaloneSwitchAdapter extends SaloneSwitchAdapter {

        private final AtomicInteger created = new AtomicInteger();
        private volatile CyclicBarrier barrier;

        CountingSaloneSwitchAdapter(ObjectMapper objectMapper, MutableClock clock, ProviderSimulationProperties properties) {
            super(objectMapper, clock, properties);
        }

        void holdDispatchesUntil(CyclicBarrier barrier) {
            this.barrier = barrier;
        }

        int paymentsCreated() {
            return created.get();
        }

        @Override
        public DispatchResult dispatch(PaymentTransaction transaction) {
            CyclicBarrier current = barrier;
            if (current != null) {
                try {
                    current.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                } catch (BrokenBarrierException | TimeoutException e) {
                    throw new IllegalStateException(e);
                }
            }
            return super.dispatch(transaction);
        }

        @Override
        protected String newReference() {
            created.incrementAndGet();
            return super.newReference();
        }
    }
}
