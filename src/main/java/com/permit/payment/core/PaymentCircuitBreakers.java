package com.permit.payment.core;

import com.permit.payment.domain.OperationClass;
import com.permit.payment.provider.ProviderException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;
import java.util.function.Supplier;

/**
 * One circuit breaker per {@link OperationClass}.
 * <p>
 * Breakers are count based over the last {@code failureThreshold} calls and open only
 * when all of them failed, i.e. after {@code failureThreshold} consecutive failures.
 * After the cooldown the next call is the single half-open trial: success closes the
 * breaker, failure re-opens it for another cooldown. Card declines are the customer's
 * problem and never count against the card breaker.
 * <p>
 * Transient provider errors are retried inside the breaker, so one exhausted retry
 * sequence counts as one failure.
 */
@Slf4j
public class PaymentCircuitBreakers {

    private final Map<OperationClass, CircuitBreaker> breakers = new EnumMap<>(OperationClass.class);
    private final Map<OperationClass, Instant> lastFailureTimes = new ConcurrentHashMap<>();
    private final Retry transientRetry;

    public PaymentCircuitBreakers(Map<OperationClass, Settings> settings, int retryMaxAttempts, Duration retryWait) {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.ofDefaults();
        for (OperationClass operationClass : OperationClass.values()) {
            Settings s = settings.getOrDefault(operationClass, Settings.defaults(operationClass));
            CircuitBreaker breaker = registry.circuitBreaker(operationClass.getConfigKey(), configFor(operationClass, s));
            breaker.getEventPublisher()
                    .onStateTransition(event -> log.info("Circuit breaker {} transitioned {}",
                            event.getCircuitBreakerName(), event.getStateTransition()))
                    .onError(event -> lastFailureTimes.put(operationClass, Instant.now()));
            breakers.put(operationClass, breaker);
            log.info("Circuit breaker {} configured: failureThreshold={}, cooldown={}",
                    operationClass.getConfigKey(), s.getFailureThreshold(), s.getCooldown());
        }
        this.transientRetry = Retry.of("provider-transient", RetryConfig.custom()
                .maxAttempts(Math.max(1, retryMaxAttempts))
                .waitDuration(retryWait)
                .retryOnException(PaymentCircuitBreakers::isTransient)
                .build());
    }

    private static CircuitBreakerConfig configFor(OperationClass operationClass, Settings settings) {
        CircuitBreakerConfig.Builder builder = CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.getFailureThreshold())
                .minimumNumberOfCalls(settings.getFailureThreshold())
                .failureRateThreshold(100.0f)
                .permittedNumberOfCallsInHalfOpenState(1)
                .waitDurationInOpenState(settings.getCooldown())
                .automaticTransitionFromOpenToHalfOpenEnabled(false);
        if (operationClass == OperationClass.CARD_PAYMENT) {
            builder.ignoreException(e -> e instanceof ProviderException && ((ProviderException) e).isDecline());
        }
        return builder.build();
    }

    private static boolean isTransient(Throwable e) {
        return e instanceof ProviderException && ((ProviderException) e).isTransient();
    }

    /**
     * Runs the call through the breaker of the operation class. An open breaker
     * throws {@link io.github.resilience4j.circuitbreaker.CallNotPermittedException}
     * without invoking the call.
     */
    public <T> T execute(OperationClass operationClass, Supplier<T> call) {
        return breakers.get(operationClass).executeSupplier(call);
    }

    /** Like {@link #execute} with transient provider errors retried inside the breaker. */
    public <T> T executeWithRetry(OperationClass operationClass, Supplier<T> call) {
        Supplier<T> withRetry = Retry.decorateSupplier(transientRetry, call);
        return breakers.get(operationClass).executeSupplier(withRetry);
    }

    /** Registers a listener for state transitions of every breaker, e.g. to alert when one opens. */
    public void onStateTransition(BiConsumer<OperationClass, CircuitBreaker.StateTransition> listener) {
        breakers.forEach((operationClass, breaker) -> breaker.getEventPublisher()
                .onStateTransition(event -> listener.accept(operationClass, event.getStateTransition())));
    }

    public CircuitBreaker.State getState(OperationClass operationClass) {
        return breakers.get(operationClass).getState();
    }

    public boolean isOpen(OperationClass operationClass) {
        return getState(operationClass) == CircuitBreaker.State.OPEN;
    }

    /**
     * Whether a call would be let through right now. Unlike {@link #isOpen}, an open
     * breaker whose cooldown has elapsed moves to half-open here and reports true.
     * The permission is handed back, so the following {@link #execute} can take it.
     */
    public boolean isCallPermitted(OperationClass operationClass) {
        CircuitBreaker breaker = breakers.get(operationClass);
        if (!breaker.tryAcquirePermission()) {
            return false;
        }
        breaker.releasePermission();
        return true;
    }

    /** Observability snapshot: state, failures in the current window, last failure time. */
    public Map<String, Object> getStates() {
        Map<String, Object> states = new LinkedHashMap<>();
        breakers.forEach((operationClass, breaker) -> {
            Map<String, Object> state = new LinkedHashMap<>();
            state.put("state", breaker.getState().name());
            state.put("failureCount", breaker.getMetrics().getNumberOfFailedCalls());
            state.put("lastFailureTime", lastFailureTimes.get(operationClass));
            states.put(operationClass.getConfigKey(), state);
        });
        return states;
    }

    /** Failure threshold and cooldown for one operation class. */
    @lombok.Value
    public static class Settings {
        int failureThreshold;
        Duration cooldown;

        public static Settings defaults(OperationClass operationClass) {
            return new Settings(operationClass.getDefaultFailureThreshold(),
                    Duration.ofSeconds(operationClass.getDefaultCooldownSeconds()));
        }
    }
}
