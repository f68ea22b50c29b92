package com.ctis.payments.config;

import com.ctis.payments.domain.GatewayType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shared secrets used to verify provider callbacks, one per gateway type.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "payment.webhooks")
public class WebhookProperties {

    private Map<GatewayType, String> secrets = new EnumMap<>(GatewayType.class);

    public Optional<String> secretFor(GatewayType gatewayType) {
        return Optional.ofNullable(secrets.get(gatewayType)).filter(s -> !s.isBlank());
    }
}
