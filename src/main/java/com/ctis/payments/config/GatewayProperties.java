package com.ctis.payments.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Rules applied by the gateway service when creating and mutating transactions.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "payment.gateway")
public class GatewayProperties {

    /** How long a payer has from initiation to a result; fixes expiresAt. */
    @NotNull
    private Duration sessionWindow = Duration.ofMinutes(10);

    /** Exclusive upper bound on a single transaction amount. */
    @NotNull
    @DecimalMin("0.01")
    private BigDecimal maxAmount = new BigDecimal("1000000000");

    /** Used when the caller does not name a currency. */
    @NotBlank
    private String defaultCurrency = "SLE";

    /** Attempts of the read-validate-write cycle before a version race is reported. */
    @Min(1)
    private int maxUpdateAttempts = 3;
}
