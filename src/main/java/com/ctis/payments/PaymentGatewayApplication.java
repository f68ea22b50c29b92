package com.ctis.payments;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the payment gateway and reconciliation service:
 * <ul>
 *   <li>Transaction lifecycle with optimistic concurrency and an append-only audit trail</li>
 *   <li>Provider callbacks with per-gateway signature checks</li>
 *   <li>Scheduled reconciliation under a Redis lease</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
@EnableScheduling
public class PaymentGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentGatewayApplication.class, args);
    }
}
