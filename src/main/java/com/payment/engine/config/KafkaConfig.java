package com.payment.engine.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.payment.engine.messaging.OperatorAlert;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
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
 * Kafka producer configuration for operator alerts. Alerts are JSON so the ops tooling
 * can read them without Java types.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    /** Kept out of the context so it does not replace Spring Boot's web ObjectMapper. */
    private static ObjectMapper operatorAlertObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ProducerFactory<String, OperatorAlert> operatorAlertProducerFactory() {
        ObjectMapper objectMapper = operatorAlertObjectMapper();
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);

        Serializer<OperatorAlert> serializer = new Serializer<OperatorAlert>() {
            @Override
            public byte[] serialize(String topic, OperatorAlert data) {
                if (data == null) {
                    return null;
                }
                try {
                    byte[] result = objectMapper.writeValueAsBytes(data);
                    log.debug("Serialized OperatorAlert (topic={}, length={}, alertId={})",
                            topic, result.length, data.getAlertId());
                    return result;
                } catch (Exception e) {
                    log.error("Serialization failed for topic={}", topic, e);
                    throw new IllegalStateException("Failed to serialize OperatorAlert", e);
                }
            }
        };
        return new DefaultKafkaProducerFactory<>(props, new StringSerializer(), serializer);
    }

    @Bean
    public KafkaTemplate<String, OperatorAlert> operatorAlertKafkaTemplate(
            ProducerFactory<String, OperatorAlert> operatorAlertProducerFactory) {
        return new KafkaTemplate<>(operatorAlertProducerFactory);
    }
}
