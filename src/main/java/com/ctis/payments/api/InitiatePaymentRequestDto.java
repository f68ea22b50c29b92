package com.ctis.payments.api;

import com.ctis.payments.domain.GatewayType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Request body for starting a payment.
 */
@Data
public class InitiatePaymentRequestDto {

    @NotBlank(message = "clientId is required")
    @Size(max = 64)
    private String clientId;

    @NotNull(message = "amount is required")
    @DecimalMin(value = "0.01", message = "amount must be at least 0.01")
    private BigDecimal amount;

    /** ISO 4217; defaults to the configured currency. */
    @Pattern(regexp = "[A-Za-z]{3}", message = "currency must be a three-letter ISO 4217 code")
    private String currency;

    @NotNull(message = "gatewayType is required")
    private GatewayType gatewayType;

    /** Optional idempotency key chosen by the caller. */
    @Size(max = 100)
    private String transactionReference;

    private Map<String, String> metadata;
}
