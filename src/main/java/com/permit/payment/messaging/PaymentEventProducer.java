package com.permit.payment.messaging;

import com.permit.payment.domain.IntentStatus;
import com.permit.payment.persistence.entity.PaymentIntentEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes terminal payment outcomes to Kafka. Events are keyed by application id
 * for ordered processing per application.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PaymentEventProducer {

    private final KafkaTemplate<String, PaymentEvent> kafkaTemplate;

    @Value("${payment.kafka.topic.payment-events:permit-payment-events}")
    private String topic;

    public void publishOutcome(PaymentIntentEntity record, String source) {
        String eventType = record.getStatus() == IntentStatus.SUCCEEDED
                ? PaymentEvent.PAYMENT_CONFIRMED
                : PaymentEvent.PAYMENT_FAILED;
        PaymentEvent event = PaymentEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .applicationId(record.getApplicationId())
                .paymentIntentId(record.getPaymentIntentId())
                .method(record.getMethod())
                .status(record.getStatus())
                .amount(record.getAmount())
                .currency(record.getCurrency())
                .source(source)
                .timestamp(Instant.now())
                .eventType(eventType)
                .build();
        send(record.getApplicationId(), event);
    }

    private void send(String key, PaymentEvent event) {
        log.info("Publishing payment event: key={}, eventId={}, paymentIntentId={}, status={}, eventType={}",
                key, event.getEventId(), event.getPaymentIntentId(), event.getStatus(), event.getEventType());
        try {
            CompletableFuture<SendResult<String, PaymentEvent>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("Failed to publish payment event key={} eventId={}", key, event.getEventId(), ex);
                } else {
                    log.info("Published payment event: key={}, eventId={}, partition={}, offset={}",
                            key, event.getEventId(),
                            result != null ? result.getRecordMetadata().partition() : null,
                            result != null ? result.getRecordMetadata().offset() : null);
                }
            });
        } catch (Exception e) {
            log.error("Failed to publish payment event key={} eventId={}", key, event.getEventId(), e);
        }
    }
}
