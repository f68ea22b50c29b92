package com.ctis.payments.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core beans: property bindings, the clock every timeout is measured against, and the
 * pool provider calls run on so a time limiter can abandon them.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties({
        GatewayProperties.class,
        ReconciliationProperties.class,
        WebhookProperties.class,
        ClientDirectoryProperties.class,
        ProviderSimulationProperties.class
})
public class PaymentGatewayConfig {

    public static final String PROVIDER_CALL_EXECUTOR = "providerCallExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = PROVIDER_CALL_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService providerCallExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "provider-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        log.info("Creating provider call executor");
        return Executors.newFixedThreadPool(16, threadFactory);
    }
}
