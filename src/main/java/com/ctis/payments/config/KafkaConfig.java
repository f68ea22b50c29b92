package com.ctis.payments.config;

import com.ctis.payments.messaging.PaymentStatusEvent;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Producer for payment status events, serialized as JSON with ISO-8601 timestamps.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    /** Upper bound on how long {@code send} may block waiting for broker metadata. */
    @Value("${payment.kafka.max-block-ms:5000}")
    private long maxBlockMs;

    /** Kept out of the context so Spring Boot's own ObjectMapper stays the MVC default. */
    static ObjectMapper eventObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ProducerFactory<String, PaymentStatusEvent> paymentStatusEventProducerFactory() {
        ObjectMapper objectMapper = eventObjectMapper();
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);

        Serializer<PaymentStatusEvent> serializer = new Serializer<PaymentStatusEvent>() {
            @Override
            public byte[] serialize(String topic, PaymentStatusEvent data) {
                if (data == null) {
                    return null;
                }
                try {
                    byte[] result = objectMapper.writeValueAsBytes(data);
                    log.debug("Serialized PaymentStatusEvent (topic={}, length={}, eventId={})",
                            topic, result.length, data.getEventId());
                    return result;
                } catch (Exception e) {
                    throw new SerializationException("Failed to serialize PaymentStatusEvent " + data.getEventId(), e);
                }
            }
        };
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, PaymentStatusEvent> paymentStatusKafkaTemplate(
            ProducerFactory<String, PaymentStatusEvent> paymentStatusEventProducerFactory) {
        return new KafkaTemplate<>(paymentStatusEventProducerFactory);
    }
}
