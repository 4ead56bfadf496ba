package com.permit.payment.recovery;

import com.permit.payment.application.PermitApplicationGateway;
import com.permit.payment.core.IdempotencyService;
import com.permit.payment.core.PaymentCircuitBreakers;
import com.permit.payment.core.PaymentGatewayClient;
import com.permit.payment.core.PaymentStatusService;
import com.permit.payment.domain.AlertSeverity;
import com.permit.payment.domain.ApplicationStatus;
import com.permit.payment.domain.IntentStatus;
import com.permit.payment.domain.OperationClass;
import com.permit.payment.domain.PaymentMethod;
import com.permit.payment.domain.ProviderPaymentIntent;
import com.permit.payment.domain.ReconciliationResult;
import com.permit.payment.domain.RecoveryResult;
import com.permit.payment.domain.RecoveryStatus;
import com.permit.payment.domain.RecoveryStatusView;
import com.permit.payment.messaging.AlertProducer;
import com.permit.payment.messaging.OperationalAlert;
import com.permit.payment.persistence.entity.PaymentIntentEntity;
import com.permit.payment.persistence.entity.RecoveryAttemptEntity;
import com.permit.payment.persistence.service.PaymentIntentPersistenceService;
import com.permit.payment.persistence.service.RecoveryAttemptPersistenceService;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PaymentRecoveryService with a real recovery circuit breaker and
 * mocked provider, persistence and scheduling.
 */
@ExtendWith(MockitoExtension.class)
class PaymentRecoveryServiceTest {

    private static final String APP = "app_42";
    private static final String PI = "pi_123";
    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private PaymentGatewayClient gatewayClient;

    @Mock
    private IdempotencyService idempotencyService;

    @Mock
    private RecoveryAttemptPersistenceService recoveryPersistence;

    @Mock
    private PaymentIntentPersistenceService intentPersistence;

    @Mock
    private PaymentStatusService statusService;

    @Mock
    private PermitApplicationGateway applicationGateway;

    @Mock
    private AlertProducer alertProducer;

    @Mock
    private RecoveryCheckScheduler recheckScheduler;

    private PaymentCircuitBreakers circuitBreakers;
    private PaymentRecoveryService service;

    @BeforeEach
    void setUp() {
        circuitBreakers = breakers(Duration.ofMinutes(1));
        service = newService(circuitBreakers);
    }

    private static PaymentCircuitBreakers breakers(Duration cooldown) {
        Map<OperationClass, PaymentCircuitBreakers.Settings> settings = new EnumMap<>(OperationClass.class);
        for (OperationClass operationClass : OperationClass.values()) {
            settings.put(operationClass, new PaymentCircuitBreakers.Settings(2, cooldown));
        }
        return new PaymentCircuitBreakers(settings, 1, Duration.ofMillis(1));
    }

    private PaymentRecoveryService newService(PaymentCircuitBreakers breakers) {
        return new PaymentRecoveryService(gatewayClient, breakers, idempotencyService, recoveryPersistence,
                intentPersistence, statusService, applicationGateway, alertProducer, recheckScheduler,
                Clock.fixed(NOW, ZoneOffset.UTC), 3,
                new Duration[]{Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofSeconds(120)});
    }

    private static void tripRecoveryBreaker(PaymentCircuitBreakers breakers) {
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> breakers.execute(OperationClass.RECOVERY, () -> {
                throw new IllegalStateException("provider down");
            })).isInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void cachedResultIsReturnedWithoutCallingProvider() {
        RecoveryResult cached = RecoveryResult.builder()
                .success(true)
                .reason(RecoveryResult.PAYMENT_SUCCEEDED)
                .applicationId(APP)
                .paymentIntentId(PI)
                .build();
        when(idempotencyService.getCachedRecoveryResult(APP, PI)).thenReturn(Optional.of(cached));

        RecoveryResult result = service.attemptPaymentRecovery(APP, PI, Map.of("trigger", "manual"));

        assertThat(result).isSameAs(cached);
        verify(gatewayClient, never()).retrievePaymentIntent(anyString());
        verify(recoveryPersistence, never()).recordAttempt(anyString(), anyString(), any());
    }

    @Test
    void openBreakerShortCircuitsAndCountsTrip() {
        tripRecoveryBreaker(circuitBreakers);

        RecoveryResult result = service.attemptPaymentRecovery(APP, PI, Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isEqualTo(RecoveryResult.CIRCUIT_BREAKER_OPEN);
        assertThat(service.getMetrics()).containsEntry("circuitBreakerTrips", 1L);
        verify(gatewayClient, never()).retrievePaymentIntent(anyString());
        verify(idempotencyService, never()).storeRecoveryResult(anyString(), anyString(), any());
    }

    @Test
    void breakerAllowsOneTrialAfterCooldownAndClosesWhenItSucceeds() throws InterruptedException {
        PaymentCircuitBreakers fastBreakers = breakers(Duration.ofMillis(50));
        PaymentRecoveryService recovery = newService(fastBreakers);
        tripRecoveryBreaker(fastBreakers);
        assertThat(recovery.attemptPaymentRecovery(APP, PI, Map.of()).getReason())
                .isEqualTo(RecoveryResult.CIRCUIT_BREAKER_OPEN);

        Thread.sleep(200);
        when(recoveryPersistence.recordAttempt(APP, PI, NOW)).thenReturn(attempts(1));
        when(gatewayClient.retrievePaymentIntent(PI)).thenReturn(Optional.of(provider(IntentStatus.SUCCEEDED)));
        when(intentPersistence.findByPaymentIntentId(PI)).thenReturn(Optional.of(local(IntentStatus.PROCESSING)));

        RecoveryResult result = recovery.attemptPaymentRecovery(APP, PI, Map.of("trigger", "scheduled_sweep"));

        assertThat(result.getReason()).isEqualTo(RecoveryResult.PAYMENT_SUCCEEDED);
        verify(gatewayClient).retrievePaymentIntent(PI);
        assertThat(fastBreakers.getState(OperationClass.RECOVERY)).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void failedTrialAfterCooldownReopensBreaker() throws InterruptedException {
        PaymentCircuitBreakers fastBreakers = breakers(Duration.ofMillis(50));
        PaymentRecoveryService recovery = newService(fastBreakers);
        tripRecoveryBreaker(fastBreakers);

        Thread.sleep(200);
        when(recoveryPersistence.recordAttempt(APP, PI, NOW)).thenReturn(attempts(1));
        when(gatewayClient.retrievePaymentIntent(PI)).thenThrow(new IllegalStateException("connection refused"));

        RecoveryResult trial = recovery.attemptPaymentRecovery(APP, PI, Map.of());
        RecoveryResult next = recovery.attemptPaymentRecovery(APP, PI, Map.of());

        assertThat(trial.getReason()).isEqualTo(RecoveryResult.RECOVERY_ERROR);
        assertThat(next.getReason()).isEqualTo(RecoveryResult.CIRCUIT_BREAKER_OPEN);
        assertThat(fastBreakers.getState(OperationClass.RECOVERY)).isEqualTo(CircuitBreaker.State.OPEN);
        verify(gatewayClient, times(1)).retrievePaymentIntent(PI);
    }

    @Test
    void exhaustedAttemptsAreNotRetried() {
        when(recoveryPersistence.find(APP, PI)).thenReturn(Optional.of(attempts(3)));

        RecoveryResult result = service.attemptPaymentRecovery(APP, PI, Map.of());

        assertThat(result.getReason()).isEqualTo(RecoveryResult.MAX_ATTEMPTS_REACHED);
        verify(recoveryPersistence).updateOutcome(eq(APP), eq(PI), eq(RecoveryStatus.MAX_ATTEMPTS_REACHED), anyString());
        verify(gatewayClient, never()).retrievePaymentIntent(anyString());
        verify(idempotencyService).storeRecoveryResult(APP, PI, result);
    }

    @Test
    void succeededIntentIsAppliedAndApplicationMovesToProcessing() {
        PaymentIntentEntity local = local(IntentStatus.PROCESSING);
        when(recoveryPersistence.recordAttempt(APP, PI, NOW)).thenReturn(attempts(1));
        when(gatewayClient.retrievePaymentIntent(PI)).thenReturn(Optional.of(provider(IntentStatus.SUCCEEDED)));
        when(intentPersistence.findByPaymentIntentId(PI)).thenReturn(Optional.of(local));

        RecoveryResult result = service.attemptPaymentRecovery(APP, PI, Map.of());

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getReason()).isEqualTo(RecoveryResult.PAYMENT_SUCCEEDED);
        verify(statusService).applyProviderStatus(local, IntentStatus.SUCCEEDED, "recovery", null, null);
        verify(statusService).convergeApplication(APP, ApplicationStatus.PAYMENT_PROCESSING);
        verify(recheckScheduler).cancel(APP, PI);
        verify(recoveryPersistence).updateOutcome(APP, PI, RecoveryStatus.SUCCEEDED, null);
        verify(idempotencyService).storeRecoveryResult(APP, PI, result);
        assertThat(service.getMetrics()).containsEntry("successfulRecoveries", 1L);
    }

    @Test
    void processingIntentSchedulesOneRecheckWithAttemptDelay() {
        when(recoveryPersistence.recordAttempt(APP, PI, NOW)).thenReturn(attempts(2));
        when(gatewayClient.retrievePaymentIntent(PI)).thenReturn(Optional.of(provider(IntentStatus.PROCESSING)));

        RecoveryResult result = service.attemptPaymentRecovery(APP, PI, Map.of());

        assertThat(result.getReason()).isEqualTo(RecoveryResult.STILL_PROCESSING);
        assertThat(result.getNextCheckIn()).isEqualTo(60L);
        ArgumentCaptor<Runnable> recheck = ArgumentCaptor.forClass(Runnable.class);
        verify(recheckScheduler, times(1)).schedule(eq(APP), eq(PI), eq(Duration.ofSeconds(60)), recheck.capture());
        verify(recoveryPersistence).updateOutcome(APP, PI, RecoveryStatus.RECOVERING, null);

        recheck.getValue().run();

        verify(idempotencyService).evictRecoveryResult(APP, PI);
        verify(gatewayClient, times(2)).retrievePaymentIntent(PI);
    }

    @Test
    void authorizedIntentIsCapturedWhenApplicationAllowsIt() {
        when(recoveryPersistence.recordAttempt(APP, PI, NOW)).thenReturn(attempts(1));
        when(gatewayClient.retrievePaymentIntent(PI)).thenReturn(Optional.of(provider(IntentStatus.REQUIRES_CAPTURE)));
        when(applicationGateway.findStatus(APP)).thenReturn(Optional.of(ApplicationStatus.APPROVED));
        when(gatewayClient.capturePaymentIntent(PI, PaymentMethod.CARD)).thenReturn(provider(IntentStatus.SUCCEEDED));

        RecoveryResult result = service.attemptPaymentRecovery(APP, PI, Map.of());

        assertThat(result.getReason()).isEqualTo(RecoveryResult.PAYMENT_SUCCEEDED);
        verify(alertProducer, never()).send(any(OperationalAlert.class));
    }

    @Test
    void authorizedIntentOfIneligibleApplicationRequestsManualCapture() {
        when(recoveryPersistence.recordAttempt(APP, PI, NOW)).thenReturn(attempts(1));
        when(gatewayClient.retrievePaymentIntent(PI)).thenReturn(Optional.of(provider(IntentStatus.REQUIRES_CAPTURE)));
        when(applicationGateway.findStatus(APP)).thenReturn(Optional.of(ApplicationStatus.PENDING_PAYMENT));

        RecoveryResult result = service.attemptPaymentRecovery(APP, PI, Map.of());

        assertThat(result.getReason()).isEqualTo(RecoveryResult.REQUIRES_MANUAL_CAPTURE);
        assertThat(result.getUserAction()).isEqualTo("await_admin_review");
        verify(gatewayClient, never()).capturePaymentIntent(anyString(), any());
        ArgumentCaptor<OperationalAlert> alert = ArgumentCaptor.forClass(OperationalAlert.class);
        verify(alertProducer).send(alert.capture());
        assertThat(alert.getValue().getSeverity()).isEqualTo(AlertSeverity.MEDIUM);
        verify(statusService).convergeApplication(APP, ApplicationStatus.PAYMENT_PROCESSING);
    }

    @Test
    void canceledIntentFailsApplicationAndAsksForNewPayment() {
        when(recoveryPersistence.recordAttempt(APP, PI, NOW)).thenReturn(attempts(1));
        when(gatewayClient.retrievePaymentIntent(PI)).thenReturn(Optional.of(provider(IntentStatus.CANCELED)));

        RecoveryResult result = service.attemptPaymentRecovery(APP, PI, Map.of());

        assertThat(result.getReason()).isEqualTo(RecoveryResult.PAYMENT_CANCELED);
        assertThat(result.getUserAction()).isEqualTo("retry_payment");
        verify(statusService).convergeApplication(APP, ApplicationStatus.PAYMENT_FAILED);
        verify(recoveryPersistence).updateOutcome(APP, PI, RecoveryStatus.FAILED, RecoveryResult.PAYMENT_CANCELED);
    }

    @Test
    void unknownIntentAtProviderIsReported() {
        when(recoveryPersistence.recordAttempt(APP, PI, NOW)).thenReturn(attempts(1));
        when(gatewayClient.retrievePaymentIntent(PI)).thenReturn(Optional.empty());

        RecoveryResult result = service.attemptPaymentRecovery(APP, PI, Map.of());

        assertThat(result.getReason()).isEqualTo(RecoveryResult.PAYMENT_INTENT_NOT_FOUND);
    }

    @Test
    void providerErrorBecomesRecoveryErrorInsteadOfThrowing() {
        when(recoveryPersistence.recordAttempt(APP, PI, NOW)).thenReturn(attempts(1));
        when(gatewayClient.retrievePaymentIntent(PI)).thenThrow(new IllegalStateException("connection refused"));

        RecoveryResult result = service.attemptPaymentRecovery(APP, PI, Map.of());

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isEqualTo(RecoveryResult.RECOVERY_ERROR);
        assertThat(result.getError()).isEqualTo("connection refused");
        verify(recoveryPersistence).updateOutcome(APP, PI, RecoveryStatus.FAILED, "connection refused");
        assertThat(service.getMetrics()).containsEntry("failedRecoveries", 1L);
    }

    @Test
    void reconcileMovesLocalStatusForward() {
        PaymentIntentEntity local = local(IntentStatus.PROCESSING);
        when(applicationGateway.findStatus(APP)).thenReturn(Optional.of(ApplicationStatus.PAYMENT_PROCESSING));
        when(intentPersistence.findLatestForApplication(APP)).thenReturn(Optional.of(local));
        when(gatewayClient.retrievePaymentIntent(PI, PaymentMethod.CARD)).thenReturn(Optional.of(provider(IntentStatus.SUCCEEDED)));
        when(statusService.applyProviderStatus(local, IntentStatus.SUCCEEDED, "reconciliation", null, null))
                .thenReturn(new PaymentStatusService.StatusUpdate(true, IntentStatus.PROCESSING, IntentStatus.SUCCEEDED));

        ReconciliationResult result = service.reconcilePaymentStatus(APP);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getReason()).isEqualTo(ReconciliationResult.STATUS_UPDATED);
        assertThat(result.getOldStatus()).isEqualTo(IntentStatus.PROCESSING);
        assertThat(result.getNewStatus()).isEqualTo(IntentStatus.SUCCEEDED);
        verify(statusService).convergeApplication(APP, ApplicationStatus.PAYMENT_RECEIVED);
        verify(intentPersistence, never()).markChecked(any());
    }

    @Test
    void reconcileReportsStatusInSync() {
        PaymentIntentEntity local = local(IntentStatus.SUCCEEDED);
        when(applicationGateway.findStatus(APP)).thenReturn(Optional.of(ApplicationStatus.PAYMENT_RECEIVED));
        when(intentPersistence.findLatestForApplication(APP)).thenReturn(Optional.of(local));
        when(gatewayClient.retrievePaymentIntent(PI, PaymentMethod.CARD)).thenReturn(Optional.of(provider(IntentStatus.SUCCEEDED)));
        when(statusService.applyProviderStatus(local, IntentStatus.SUCCEEDED, "reconciliation", null, null))
                .thenReturn(new PaymentStatusService.StatusUpdate(false, IntentStatus.SUCCEEDED, IntentStatus.SUCCEEDED));

        ReconciliationResult result = service.reconcilePaymentStatus(APP);

        assertThat(result.getReason()).isEqualTo(ReconciliationResult.STATUS_IN_SYNC);
        verify(statusService, never()).convergeApplication(anyString(), any());
    }

    @Test
    void inSyncOpenPaymentIsMarkedCheckedSoSweepRotates() {
        PaymentIntentEntity local = local(IntentStatus.PROCESSING);
        when(applicationGateway.findStatus(APP)).thenReturn(Optional.of(ApplicationStatus.PAYMENT_PROCESSING));
        when(intentPersistence.findLatestForApplication(APP)).thenReturn(Optional.of(local));
        when(gatewayClient.retrievePaymentIntent(PI, PaymentMethod.CARD)).thenReturn(Optional.of(provider(IntentStatus.PROCESSING)));
        when(statusService.applyProviderStatus(local, IntentStatus.PROCESSING, "reconciliation", null, null))
                .thenReturn(new PaymentStatusService.StatusUpdate(false, IntentStatus.PROCESSING, IntentStatus.PROCESSING));

        ReconciliationResult result = service.reconcilePaymentStatus(APP);

        assertThat(result.getReason()).isEqualTo(ReconciliationResult.STATUS_IN_SYNC);
        verify(intentPersistence).markChecked(local);
    }

    @Test
    void reconcileWithoutPaymentOrder() {
        when(applicationGateway.findStatus(APP)).thenReturn(Optional.of(ApplicationStatus.PENDING_PAYMENT));
        when(intentPersistence.findLatestForApplication(APP)).thenReturn(Optional.empty());

        ReconciliationResult result = service.reconcilePaymentStatus(APP);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getReason()).isEqualTo(ReconciliationResult.NO_PAYMENT_ORDER);
    }

    @Test
    void reconcileOfMissingApplication() {
        when(applicationGateway.findStatus(APP)).thenReturn(Optional.empty());

        ReconciliationResult result = service.reconcilePaymentStatus(APP);

        assertThat(result.getReason()).isEqualTo(ReconciliationResult.RECONCILIATION_ERROR);
        assertThat(result.getError()).contains("Application not found");
    }

    @Test
    void recoveryStatusReportsAttemptsAndNextDelay() {
        RecoveryStatusView none = service.getRecoveryStatus(APP, PI);
        assertThat(none.getAttempts()).isZero();
        assertThat(none.isCanRetry()).isTrue();
        assertThat(none.getStatus()).isEqualTo(RecoveryStatus.NOT_ATTEMPTED);
        assertThat(none.getNextAttemptDelayMs()).isEqualTo(30_000L);

        when(recoveryPersistence.find(APP, PI)).thenReturn(Optional.of(attempts(2)));
        RecoveryStatusView two = service.getRecoveryStatus(APP, PI);
        assertThat(two.getAttempts()).isEqualTo(2);
        assertThat(two.isCanRetry()).isTrue();
        assertThat(two.getNextAttemptDelayMs()).isEqualTo(120_000L);
    }

    @Test
    void recoveryDelaysDoubleBeyondTable() {
        assertThat(service.getRecoveryDelay(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(service.getRecoveryDelay(2)).isEqualTo(Duration.ofSeconds(60));
        assertThat(service.getRecoveryDelay(3)).isEqualTo(Duration.ofSeconds(120));
        assertThat(service.getRecoveryDelay(4)).isEqualTo(Duration.ofSeconds(240));
        assertThat(service.getRecoveryDelay(5)).isEqualTo(Duration.ofSeconds(480));
    }

    private static RecoveryAttemptEntity attempts(int count) {
        return RecoveryAttemptEntity.builder()
                .applicationId(APP)
                .paymentIntentId(PI)
                .attemptCount(count)
                .recoveryStatus(RecoveryStatus.RECOVERING)
                .lastAttemptTime(NOW)
                .build();
    }

    private static ProviderPaymentIntent provider(IntentStatus status) {
        return ProviderPaymentIntent.builder()
                .id(PI)
                .status(status)
                .paymentMethod("card")
                .amount(new BigDecimal("150.00"))
                .currency("MXN")
                .metadata(Map.of("application_id", APP))
                .build();
    }

    private static PaymentIntentEntity local(IntentStatus status) {
        return PaymentIntentEntity.builder()
                .idempotencyKey("pi_card_" + APP + "_cus_1")
                .paymentIntentId(PI)
                .applicationId(APP)
                .amount(new BigDecimal("150.00"))
                .currency("MXN")
                .method(PaymentMethod.CARD)
                .status(status)
                .build();
    }
}
