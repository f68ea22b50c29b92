package com.ctis.payments.api;

import com.ctis.payments.domain.ProviderStatus;
import com.ctis.payments.domain.TransactionStatus;
import lombok.Builder;
import lombok.Value;

/**
 * Answer of a status check. {@code reachable=false} means the provider could not be
 * asked; {@code status} is then null and the stored row is unchanged.
 */
@Value
@Builder
public class StatusResponseDto {

    Long transactionId;
    boolean reachable;
    TransactionStatus status;
    String message;

    public static StatusResponseDto from(Long transactionId, ProviderStatus providerStatus) {
        return StatusResponseDto.builder()
                .transactionId(transactionId)
                .reachable(providerStatus.isReachable())
                .status(providerStatus.getStatus())
                .message(providerStatus.getMessage())
                .build();
    }
}
