package com.ctis.payments.messaging;

import com.ctis.payments.domain.PaymentTransaction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes {@link PaymentStatusEvent}s to the {@code payment-status-events} topic.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class KafkaPaymentNotificationDispatcher implements PaymentNotificationDispatcher {

    private final KafkaTemplate<String, PaymentStatusEvent> kafkaTemplate;
    private final Clock clock;

    @Value("${payment.kafka.topic.payment-status-events:payment-status-events}")
    private String topic;

    @Override
    public void onTerminal(PaymentTransaction transaction) {
        PaymentStatusEvent event = PaymentStatusEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .transactionId(transaction.getId())
                .transactionReference(transaction.getTransactionReference())
                .externalReference(transaction.getExternalReference())
                .clientId(transaction.getClientId())
                .gatewayType(transaction.getGatewayType())
                .status(transaction.getStatus())
                .amount(transaction.getAmount())
                .currency(transaction.getCurrency())
                .message(transaction.getStatusMessage())
                .occurredAt(Instant.now(clock))
                .build();
        send(transaction.getTransactionReference(), event);
    }

    private void send(String key, PaymentStatusEvent event) {
        log.info("Publishing payment status event: key={}, eventId={}, transactionId={}, status={}",
                key, event.getEventId(), event.getTransactionId(), event.getStatus());
        CompletableFuture<SendResult<String, PaymentStatusEvent>> future = kafkaTemplate.send(topic, key, event);
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish payment status event key={} eventId={}", key, event.getEventId(), ex);
            } else {
                log.debug("Published payment status event: key={}, eventId={}, partition={}, offset={}",
                        key, event.getEventId(),
                        result != null ? result.getRecordMetadata().partition() : null,
                        result != null ? result.getRecordMetadata().offset() : null);
            }
        });
    }
}
