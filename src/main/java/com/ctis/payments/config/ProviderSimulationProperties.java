package com.ctis.payments.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Behaviour of the simulated provider adapters used until real rails are wired in.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "payment.providers.simulation")
public class ProviderSimulationProperties {

    private boolean enabled = true;

    /** Time after dispatch when a simulated payment reports its outcome. */
    private Duration settleAfter = Duration.ofSeconds(30);

    /** Amounts at or above this settle as declined. */
    private BigDecimal declineThreshold = new BigDecimal("777777");

    /** How long the simulator remembers a dispatched payment. */
    private Duration retention = Duration.ofHours(24);
}
