package com.ctis.payments.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Timing and batching of the reconciliation sweep.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "payment.reconciliation")
public class ReconciliationProperties {

    private boolean enabled = true;

    /** Delay between the end of one sweep and the start of the next. */
    @NotNull
    private Duration interval = Duration.ofMinutes(1);

    @Min(1)
    private int batchSize = 50;

    /** Initiated rows younger than this belong to the interactive flow. */
    @NotNull
    private Duration dispatchGracePeriod = Duration.ofSeconds(15);

    /** Pending rows this old or older (from initiatedAt) are failed. */
    @NotNull
    private Duration pendingTimeout = Duration.ofMinutes(10);

    /** Processing rows this old or older (from processedAt) are failed. */
    @NotNull
    private Duration processingTimeout = Duration.ofMinutes(5);

    @Valid
    private Lock lock = new Lock();

    @Getter
    @Setter
    public static class Lock {

        /** {@code redis} for multi-instance deployments, {@code local} for a single process. */
        @NotBlank
        private String type = "redis";

        @NotBlank
        private String key = "payment:reconciliation:lock";

        /** Lease length; must exceed the longest expected sweep. */
        @NotNull
        private Duration ttl = Duration.ofMinutes(5);
    }
}
