package com.ctis.payments;

import com.ctis.payments.provider.WebhookSignatures;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.kafka.test.context.EmbeddedKafka;
import org.springframework.test.web.servlet.MockMvc;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Integration test: full application context with H2 and an embedded Kafka broker,
 * driving one payment from initiation to a signed settlement callback over HTTP.
 * Needs no external infrastructure.
 */
@Tag("integration")
@SpringBootTest(classes = PaymentGatewayApplication.class)
@AutoConfigureMockMvc
@EmbeddedKafka(partitions = 1, topics = "payment-status-events",
        bootstrapServersProperty = "spring.kafka.bootstrap-servers")
class PaymentGatewayApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads() {
    }

    @Test
    void paymentSettlesThroughSignedCallback() throws Exception {
        String created = mockMvc.perform(post("/api/v1/payments/transactions")
                        .header("X-User-Id", "clerk-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"clientId":"client-42","amount":250.00,"gatewayType":"SALONE_SWITCH"}
                                """))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        long id = objectMapper.readTree(created).get("transactionId").asLong();

        String processed = mockMvc.perform(post("/api/v1/payments/transactions/{id}/process", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PROCESSING"))
                .andReturn().getResponse().getContentAsString();
        JsonNode transaction = objectMapper.readTree(processed);
        String body = "{\"endToEndId\":\"" + transaction.get("externalReference").asText() + "\",\"txSts\":\"ACSC\"}";
        String signature = "sha256=" + WebhookSignatures.hmacHex(WebhookSignatures.HMAC_SHA256, "salone-test-secret", body);

        mockMvc.perform(post("/api/v1/webhooks/SALONE_SWITCH")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Signature", signature)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(content().json("{\"received\":true}", true));
        mockMvc.perform(post("/api/v1/webhooks/SALONE_SWITCH")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Signature", signature)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(content().json("{\"received\":true}", true));

        mockMvc.perform(get("/api/v1/payments/transactions/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"));
        mockMvc.perform(get("/api/v1/payments/transactions/{id}/audit", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3));
    }
}
