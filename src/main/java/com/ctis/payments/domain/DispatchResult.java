package com.ctis.payments.domain;

import lombok.Builder;
import lombok.Value;

/**
 * What the provider returned when a payment (or a confirmation prompt) was sent.
 */
@Value
@Builder
public class DispatchResult {

    String externalReference;
    String message;
}
