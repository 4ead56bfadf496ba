package com.permit.payment.core;

import com.permit.payment.domain.OperationClass;
import com.permit.payment.provider.ProviderException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Circuit breaker behaviour with real Resilience4j breakers and a short cooldown.
 */
class PaymentCircuitBreakersTest {

    private static final Duration COOLDOWN = Duration.ofMillis(100);

    private PaymentCircuitBreakers breakers;
    private final AtomicInteger invocations = new AtomicInteger();

    @BeforeEach
    void setUp() {
        Map<OperationClass, PaymentCircuitBreakers.Settings> settings = new EnumMap<>(OperationClass.class);
        for (OperationClass operationClass : OperationClass.values()) {
            settings.put(operationClass, new PaymentCircuitBreakers.Settings(3, COOLDOWN));
        }
        breakers = new PaymentCircuitBreakers(settings, 2, Duration.ofMillis(1));
    }

    @Test
    void opensAfterConsecutiveFailuresAndRejectsWithoutInvoking() {
        failTimes(OperationClass.CASH_VOUCHER_PAYMENT, 3);
        assertThat(breakers.getState(OperationClass.CASH_VOUCHER_PAYMENT)).isEqualTo(CircuitBreaker.State.OPEN);

        invocations.set(0);
        assertThatThrownBy(() -> breakers.execute(OperationClass.CASH_VOUCHER_PAYMENT, this::succeed))
                .isInstanceOf(CallNotPermittedException.class);
        assertThat(invocations).hasValue(0);
    }

    @Test
    void successResetsTheConsecutiveFailureCount() {
        failTimes(OperationClass.CARD_PAYMENT, 2);
        breakers.execute(OperationClass.CARD_PAYMENT, this::succeed);
        failTimes(OperationClass.CARD_PAYMENT, 2);

        assertThat(breakers.getState(OperationClass.CARD_PAYMENT)).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void halfOpenAllowsExactlyOneTrialAndSuccessCloses() throws Exception {
        failTimes(OperationClass.RECOVERY, 3);
        Thread.sleep(COOLDOWN.toMillis() + 50);

        String result = breakers.execute(OperationClass.RECOVERY, () -> {
            assertThat(breakers.getState(OperationClass.RECOVERY)).isEqualTo(CircuitBreaker.State.HALF_OPEN);
            assertThatThrownBy(() -> breakers.execute(OperationClass.RECOVERY, this::succeed))
                    .isInstanceOf(CallNotPermittedException.class);
            return "trial";
        });

        assertThat(result).isEqualTo("trial");
        assertThat(breakers.getState(OperationClass.RECOVERY)).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(breakers.getStates()).containsKey("recovery");
    }

    @Test
    void callPermittedCheckMovesExpiredOpenBreakerToHalfOpenWithoutUsingTheTrial() throws Exception {
        failTimes(OperationClass.RECOVERY, 3);
        assertThat(breakers.isCallPermitted(OperationClass.RECOVERY)).isFalse();

        Thread.sleep(COOLDOWN.toMillis() + 50);

        assertThat(breakers.isCallPermitted(OperationClass.RECOVERY)).isTrue();
        assertThat(breakers.getState(OperationClass.RECOVERY)).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        invocations.set(0);
        breakers.execute(OperationClass.RECOVERY, this::succeed);
        assertThat(invocations).hasValue(1);
        assertThat(breakers.getState(OperationClass.RECOVERY)).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void failedTrialReopensForAnotherCooldown() throws Exception {
        failTimes(OperationClass.CUSTOMER_OPERATIONS, 3);
        Thread.sleep(COOLDOWN.toMillis() + 50);

        failTimes(OperationClass.CUSTOMER_OPERATIONS, 1);

        assertThat(breakers.isOpen(OperationClass.CUSTOMER_OPERATIONS)).isTrue();
        assertThatThrownBy(() -> breakers.execute(OperationClass.CUSTOMER_OPERATIONS, this::succeed))
                .isInstanceOf(CallNotPermittedException.class);
    }

    @Test
    void cardDeclinesDoNotTripTheCardBreaker() {
        for (int i = 0; i < 5; i++) {
            assertThatThrownBy(() -> breakers.execute(OperationClass.CARD_PAYMENT, () -> {
                throw new ProviderException("Your card was declined.", "card_declined", "card_error", 402, false, null);
            })).isInstanceOf(ProviderException.class);
        }

        assertThat(breakers.getState(OperationClass.CARD_PAYMENT)).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void breakersAreIndependentPerOperationClass() {
        failTimes(OperationClass.CARD_PAYMENT, 3);

        assertThat(breakers.isOpen(OperationClass.CARD_PAYMENT)).isTrue();
        assertThat(breakers.execute(OperationClass.CASH_VOUCHER_PAYMENT, this::succeed)).isEqualTo("ok");
    }

    @Test
    void transientErrorsAreRetriedInsideTheBreaker() {
        AtomicInteger calls = new AtomicInteger();

        String result = breakers.executeWithRetry(OperationClass.CARD_PAYMENT, () -> {
            if (calls.incrementAndGet() == 1) {
                throw ProviderException.transientError("connection reset", null);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(2);
        assertThat(breakers.getState(OperationClass.CARD_PAYMENT)).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void nonTransientErrorsAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> breakers.executeWithRetry(OperationClass.CARD_PAYMENT, () -> {
            calls.incrementAndGet();
            throw new ProviderException("bad request", "parameter_invalid_integer", "invalid_request_error", 400, false, null);
        })).isInstanceOf(ProviderException.class);

        assertThat(calls).hasValue(1);
    }

    private void failTimes(OperationClass operationClass, int times) {
        for (int i = 0; i < times; i++) {
            assertThatThrownBy(() -> breakers.execute(operationClass, () -> {
                throw ProviderException.transientError("timeout", null);
            })).isInstanceOf(ProviderException.class);
        }
    }

    private String succeed() {
        invocations.incrementAndGet();
        return "ok";
    }
}
