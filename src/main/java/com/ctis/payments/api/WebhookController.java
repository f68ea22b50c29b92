package com.ctis.payments.api;

import com.ctis.payments.domain.GatewayType;
import com.ctis.payments.webhook.WebhookIngestor;
import com.ctis.payments.webhook.WebhookOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Provider callbacks. The body is taken raw so the signature is checked over the exact
 * bytes the provider signed.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/webhooks")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Asynchronous status callbacks from payment providers")
public class WebhookController {

    static final String SIGNATURE_HEADER = "X-Signature";

    private final WebhookIngestor ingestor;

    @PostMapping("/{gatewayType}")
    @Operation(summary = "Receive provider callback",
            description = "Verifies the signature and applies the reported status. Redeliveries are acknowledged without side effects.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Acknowledged. Body: { \"received\": true }, the same for new and repeated deliveries"),
            @ApiResponse(responseCode = "401", description = "Missing or invalid signature"),
            @ApiResponse(responseCode = "404", description = "No transaction with that external reference"),
            @ApiResponse(responseCode = "422", description = "Status code not known for this gateway")
    })
    public Map<String, Boolean> receive(@PathVariable("gatewayType") GatewayType gatewayType,
                                       @RequestBody String rawPayload,
                                       @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        WebhookOutcome outcome = ingestor.ingest(gatewayType, rawPayload, signature);
        log.info("Webhook from {} handled: outcome={}", gatewayType, outcome);
        return Map.of("received", true);
    }
}
