package com.ctis.payments.exception;

import com.ctis.payments.domain.GatewayType;
import lombok.Getter;

/**
 * A provider reported a status code missing from the status table. Surfaced as a
 * diagnostic error instead of being dropped or guessed.
 */
@Getter
public class UnmappedStatusCodeException extends RuntimeException {

    private final GatewayType gatewayType;
    private final String code;

    public UnmappedStatusCodeException(GatewayType gatewayType, String code) {
        super("Unmapped " + gatewayType + " status code: " + code);
        this.gatewayType = gatewayType;
        this.code = code;
    }
}
