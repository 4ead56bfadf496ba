package com.permit.payment.messaging;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes operational alerts to a dedicated topic for paging and dashboards.
 * Delivery failures are logged, never thrown, so a broken alert channel cannot
 * mask the failure being reported.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertProducer {

    private final KafkaTemplate<String, OperationalAlert> alertKafkaTemplate;

    @Value("${payment.kafka.topic.alerts:payment-alerts}")
    private String topic;

    public void send(OperationalAlert alert) {
        log.warn("[ALERT] severity={} title=\"{}\" message=\"{}\"", alert.getSeverity(), alert.getTitle(), alert.getMessage());
        try {
            CompletableFuture<SendResult<String, OperationalAlert>> future =
                    alertKafkaTemplate.send(topic, alert.getAlertId(), alert);
            future.whenComplete((result, ex) -> {
                if (ex != null) log.error("Failed to send alert {}", alert.getAlertId(), ex);
                else log.debug("Sent alert {} partition={}", alert.getAlertId(),
                        result != null ? result.getRecordMetadata().partition() : null);
            });
        } catch (Exception e) {
            log.error("Failed to send alert {} title={}", alert.getAlertId(), alert.getTitle(), e);
        }
    }
}
