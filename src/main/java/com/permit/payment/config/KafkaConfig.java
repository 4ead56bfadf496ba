package com.permit.payment.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.permit.payment.messaging.OperationalAlert;
import com.permit.payment.messaging.PaymentEvent;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.Serializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka producers for payment outcome events and operational alerts. Values are
 * plain JSON so non-Java consumers can read them.
 */
@Slf4j
@Configuration
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Bean(name = "kafkaProducerObjectMapper")
    public ObjectMapper kafkaProducerObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public ProducerFactory<String, PaymentEvent> paymentEventProducerFactory(
            @Qualifier("kafkaProducerObjectMapper") ObjectMapper objectMapper) {
        return new DefaultKafkaProducerFactory<>(producerProps(), new StringSerializer(),
                jsonSerializer(objectMapper, PaymentEvent.class));
    }

    @Bean
    public KafkaTemplate<String, PaymentEvent> kafkaTemplate(
            ProducerFactory<String, PaymentEvent> paymentEventProducerFactory) {
        return new KafkaTemplate<>(paymentEventProducerFactory);
    }

    @Bean
    public ProducerFactory<String, OperationalAlert> alertProducerFactory(
            @Qualifier("kafkaProducerObjectMapper") ObjectMapper objectMapper) {
        return new DefaultKafkaProducerFactory<>(producerProps(), new StringSerializer(),
                jsonSerializer(objectMapper, OperationalAlert.class));
    }

    @Bean
    public KafkaTemplate<String, OperationalAlert> alertKafkaTemplate(
            ProducerFactory<String, OperationalAlert> alertProducerFactory) {
        return new KafkaTemplate<>(alertProducerFactory);
    }

    private Map<String, Object> producerProps() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return props;
    }

    private static <T> Serializer<T> jsonSerializer(ObjectMapper objectMapper, Class<T> type) {
        return (topic, data) -> {
            if (data == null) {
                return null;
            }
            try {
                byte[] result = objectMapper.writeValueAsBytes(data);
                log.debug("Serialized {} (topic={}, length={})", type.getSimpleName(), topic, result.length);
                return result;
            } catch (Exception e) {
                log.error("Serialization failed for topic={}", topic, e);
                throw new IllegalStateException("Failed to serialize " + type.getSimpleName(), e);
            }
        };
    }
}
