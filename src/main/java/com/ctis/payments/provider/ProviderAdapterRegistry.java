package com.ctis.payments.provider;

import com.ctis.payments.config.PaymentGatewayConfig;
import com.ctis.payments.domain.DispatchResult;
import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.ProviderStatus;
import com.ctis.payments.exception.ProviderUnavailableException;
import com.ctis.payments.exception.UnmappedStatusCodeException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Looks up the adapter for a gateway type and runs every provider call behind that
 * adapter's circuit breaker and the shared {@code provider} time limiter. The two call
 * shapes degrade differently: dispatches raise {@link ProviderUnavailableException},
 * status queries come back as {@link ProviderStatus#unreachable}.
 */
@Slf4j
@Component
public class ProviderAdapterRegistry {

    static final String TIME_LIMITER = "provider";

    private final List<ProviderAdapter> adapters;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final TimeLimiterRegistry timeLimiterRegistry;
    private final ExecutorService executor;

    private Map<GatewayType, ProviderAdapter> adapterByType;

    public ProviderAdapterRegistry(List<ProviderAdapter> adapters,
                                   CircuitBreakerRegistry circuitBreakerRegistry,
                                   TimeLimiterRegistry timeLimiterRegistry,
                                   @Qualifier(PaymentGatewayConfig.PROVIDER_CALL_EXECUTOR) ExecutorService executor) {
        this.adapters = adapters;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.timeLimiterRegistry = timeLimiterRegistry;
        this.executor = executor;
    }

    @PostConstruct
    public void init() {
        log.info("Initializing ProviderAdapterRegistry with {} adapters", adapters.size());
        Map<GatewayType, ProviderAdapter> byType = new EnumMap<>(GatewayType.class);
        for (ProviderAdapter adapter : adapters) {
            ProviderAdapter previous = byType.putIfAbsent(adapter.getGatewayType(), adapter);
            if (previous != null) {
                log.warn("Ignoring {}: {} already serves {}", adapter.getAdapterName(),
                        previous.getAdapterName(), adapter.getGatewayType());
            }
        }
        adapterByType = byType;
        log.info("Registered provider adapters: {}", adapterByType.keySet());
    }

    /**
     * @throws ProviderUnavailableException when no adapter serves the type
     */
    public ProviderAdapter adapterFor(GatewayType gatewayType) {
        ProviderAdapter adapter = adapterByType.get(gatewayType);
        if (adapter == null) {
            throw new ProviderUnavailableException("No provider adapter registered for " + gatewayType);
        }
        return adapter;
    }

    public boolean supportsActiveQuery(GatewayType gatewayType) {
        ProviderAdapter adapter = adapterByType.get(gatewayType);
        return adapter != null && adapter.supportsActiveQuery();
    }

    /**
     * Sends the payment to its provider.
     *
     * @throws ProviderUnavailableException on timeout, open circuit or any provider error
     */
    public DispatchResult dispatch(PaymentTransaction transaction) {
        ProviderAdapter adapter = adapterFor(transaction.getGatewayType());
        return guardedDispatch(adapter, transaction, "dispatch", () -> adapter.dispatch(transaction));
    }

    /**
     * Asks the provider to prompt the payer for confirmation.
     *
     * @throws ProviderUnavailableException on timeout, open circuit, provider error, or when
     *                                      the rail has no confirmation prompt
     */
    public DispatchResult requestConfirmation(PaymentTransaction transaction) {
        ProviderAdapter adapter = adapterFor(transaction.getGatewayType());
        if (!adapter.supportsConfirmationPrompt()) {
            throw new ProviderUnavailableException(transaction.getGatewayType() + " does not support confirmation prompts");
        }
        return guardedDispatch(adapter, transaction, "confirmation request",
                () -> adapter.requestConfirmation(transaction));
    }

    /**
     * Queries the provider for the status of a dispatched payment. Never throws for
     * transport problems; an unmapped status code is still reported as an error.
     */
    public ProviderStatus queryStatus(GatewayType gatewayType, String externalReference) {
        ProviderAdapter adapter = adapterByType.get(gatewayType);
        if (adapter == null) {
            return ProviderStatus.unreachable("No provider adapter registered for " + gatewayType);
        }
        try {
            ProviderStatus status = guarded(adapter, () -> adapter.checkStatus(externalReference));
            return status != null ? status : ProviderStatus.unreachable(adapter.getAdapterName() + " returned no status");
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            if (cause instanceof UnmappedStatusCodeException) {
                throw (UnmappedStatusCodeException) cause;
            }
            log.warn("Status query failed: adapter={}, externalReference={}, reason={}",
                    adapter.getAdapterName(), externalReference, describe(cause));
            return ProviderStatus.unreachable(describe(cause));
        }
    }

    private DispatchResult guardedDispatch(ProviderAdapter adapter, PaymentTransaction transaction, String operation,
                                           Supplier<DispatchResult> call) {
        DispatchResult result;
        try {
            result = guarded(adapter, call);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            log.warn("Provider {} failed: adapter={}, transactionId={}, reason={}",
                    operation, adapter.getAdapterName(), transaction.getId(), describe(cause));
            throw new ProviderUnavailableException(
                    adapter.getGatewayType() + " " + operation + " failed: " + describe(cause), cause);
        }
        if (result == null || result.getExternalReference() == null || result.getExternalReference().isBlank()) {
            throw new ProviderUnavailableException(adapter.getAdapterName() + " returned no external reference");
        }
        return result;
    }

    private <T> T guarded(ProviderAdapter adapter, Supplier<T> call) throws Exception {
        CircuitBreaker circuitBreaker = circuitBreakerRegistry.circuitBreaker(adapter.getAdapterName());
        TimeLimiter timeLimiter = timeLimiterRegistry.timeLimiter(TIME_LIMITER);
        Callable<T> limited = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> CompletableFuture.supplyAsync(call, executor));
        return circuitBreaker.executeCallable(limited);
    }

    private static Throwable unwrap(Throwable e) {
        Throwable current = e;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String describe(Throwable cause) {
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        if (cause instanceof CallNotPermittedException) {
            return "circuit open";
        }
        return cause.getClass().getSimpleName() + (cause.getMessage() != null ? ": " + cause.getMessage() : "");
    }
}
