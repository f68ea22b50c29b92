package com.ctis.payments.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Location of the client service consulted before a transaction is created.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "payment.clients")
public class ClientDirectoryProperties {

    /** {@code http} queries the client service; {@code trust} accepts every client id. */
    private String mode = "http";

    private String baseUrl = "http://localhost:8081";

    private Duration timeout = Duration.ofSeconds(3);
}
