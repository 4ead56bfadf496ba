package com.permit.payment.config;

import com.permit.payment.core.PaymentCircuitBreakers;
import com.permit.payment.domain.AlertSeverity;
import com.permit.payment.domain.OperationClass;
import com.permit.payment.messaging.AlertProducer;
import com.permit.payment.messaging.OperationalAlert;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the per-operation-class circuit breakers from
 * {@code payment.circuit-breaker.<operation>.failure-threshold|cooldown}.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    @Value("${payment.retry.max-attempts:2}")
    private int retryMaxAttempts;

    @Value("${payment.retry.wait:1s}")
    private Duration retryWait;

    @Bean
    public PaymentCircuitBreakers paymentCircuitBreakers(Environment environment, AlertProducer alertProducer) {
        Map<OperationClass, PaymentCircuitBreakers.Settings> settings = new EnumMap<>(OperationClass.class);
        for (OperationClass operationClass : OperationClass.values()) {
            String prefix = "payment.circuit-breaker." + operationClass.getConfigKey();
            int threshold = environment.getProperty(prefix + ".failure-threshold", Integer.class,
                    operationClass.getDefaultFailureThreshold());
            Duration cooldown = environment.getProperty(prefix + ".cooldown", Duration.class,
                    Duration.ofSeconds(operationClass.getDefaultCooldownSeconds()));
            if (threshold <= 0) {
                log.error("Invalid failure-threshold {} for {}, using default {}", threshold,
                        operationClass.getConfigKey(), operationClass.getDefaultFailureThreshold());
                threshold = operationClass.getDefaultFailureThreshold();
            }
            settings.put(operationClass, new PaymentCircuitBreakers.Settings(threshold, cooldown));
        }
        PaymentCircuitBreakers breakers = new PaymentCircuitBreakers(settings, retryMaxAttempts, retryWait);
        breakers.onStateTransition((operationClass, transition) -> {
            if (transition.getToState() == CircuitBreaker.State.OPEN) {
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("operationClass", operationClass.getConfigKey());
                details.put("transition", transition.name());
                details.put("cooldown", settings.get(operationClass).getCooldown().toString());
                alertProducer.send(OperationalAlert.of("Circuit Breaker Opened",
                        "Circuit breaker " + operationClass.getConfigKey() + " opened; calls are rejected until the cooldown elapses",
                        AlertSeverity.HIGH, details));
            }
        });
        return breakers;
    }
}
