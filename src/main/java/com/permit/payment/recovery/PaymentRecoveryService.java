package com.permit.payment.recovery;

import com.permit.payment.api.PaymentConsistencyException;
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
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Pull-based correction for payments whose webhook never arrived or whose local
 * state is stale.
 * <p>
 * {@link #attemptPaymentRecovery} is guarded by the recovery result cache, the
 * recovery circuit breaker and a persisted attempt counter, then asks the provider
 * for the authoritative status and acts on it. It never throws.
 * {@link #reconcilePaymentStatus} is the operator variant without that bookkeeping.
 */
@Slf4j
@Service
public class PaymentRecoveryService {

    private static final String SOURCE_RECOVERY = "recovery";
    private static final String SOURCE_RECONCILIATION = "reconciliation";

    private final PaymentGatewayClient gatewayClient;
    private final PaymentCircuitBreakers circuitBreakers;
    private final IdempotencyService idempotencyService;
    private final RecoveryAttemptPersistenceService recoveryPersistence;
    private final PaymentIntentPersistenceService intentPersistence;
    private final PaymentStatusService statusService;
    private final PermitApplicationGateway applicationGateway;
    private final AlertProducer alertProducer;
    private final RecoveryCheckScheduler recheckScheduler;
    private final Clock clock;
    private final int maxAttempts;
    private final List<Duration> recoveryDelays;

    private final AtomicLong recoveryAttempts = new AtomicLong();
    private final AtomicLong successfulRecoveries = new AtomicLong();
    private final AtomicLong failedRecoveries = new AtomicLong();
    private final AtomicLong circuitBreakerTrips = new AtomicLong();

    public PaymentRecoveryService(PaymentGatewayClient gatewayClient,
                                  PaymentCircuitBreakers circuitBreakers,
                                  IdempotencyService idempotencyService,
                                  RecoveryAttemptPersistenceService recoveryPersistence,
                                  PaymentIntentPersistenceService intentPersistence,
                                  PaymentStatusService statusService,
                                  PermitApplicationGateway applicationGateway,
                                  AlertProducer alertProducer,
                                  RecoveryCheckScheduler recheckScheduler,
                                  Clock clock,
                                  @Value("${payment.recovery.max-attempts:3}") int maxAttempts,
                                  @Value("${payment.recovery.delays:30s,60s,120s}") Duration[] recoveryDelays) {
        if (recoveryDelays == null || recoveryDelays.length == 0) {
            throw new IllegalArgumentException("payment.recovery.delays must not be empty");
        }
        this.gatewayClient = gatewayClient;
        this.circuitBreakers = circuitBreakers;
        this.idempotencyService = idempotencyService;
        this.recoveryPersistence = recoveryPersistence;
        this.intentPersistence = intentPersistence;
        this.statusService = statusService;
        this.applicationGateway = applicationGateway;
        this.alertProducer = alertProducer;
        this.recheckScheduler = recheckScheduler;
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.recoveryDelays = List.copyOf(Arrays.asList(recoveryDelays));
    }

    /**
     * Attempts to bring the local payment and application in line with the provider.
     *
     * @param context free-form trigger description for the logs, e.g. {@code trigger=scheduled_recheck}
     */
    public RecoveryResult attemptPaymentRecovery(String applicationId, String paymentIntentId, Map<String, ?> context) {
        recoveryAttempts.incrementAndGet();
        log.info("Payment recovery requested: applicationId={}, paymentIntentId={}, context={}",
                applicationId, paymentIntentId, context);
        try {
            Optional<RecoveryResult> cached = idempotencyService.getCachedRecoveryResult(applicationId, paymentIntentId);
            if (cached.isPresent()) {
                log.info("Returning cached recovery result for applicationId={}, paymentIntentId={}: {}",
                        applicationId, paymentIntentId, cached.get().getReason());
                return cached.get();
            }

            if (!circuitBreakers.isCallPermitted(OperationClass.RECOVERY)) {
                return circuitOpen(applicationId, paymentIntentId);
            }

            Optional<RecoveryAttemptEntity> previous = recoveryPersistence.find(applicationId, paymentIntentId);
            if (previous.isPresent() && previous.get().getAttemptCount() >= maxAttempts) {
                log.warn("Max recovery attempts ({}) reached for applicationId={}, paymentIntentId={}",
                        maxAttempts, applicationId, paymentIntentId);
                recoveryPersistence.updateOutcome(applicationId, paymentIntentId,
                        RecoveryStatus.MAX_ATTEMPTS_REACHED, "Max recovery attempts reached");
                failedRecoveries.incrementAndGet();
                RecoveryResult result = result(applicationId, paymentIntentId, false, RecoveryResult.MAX_ATTEMPTS_REACHED)
                        .build();
                idempotencyService.storeRecoveryResult(applicationId, paymentIntentId, result);
                return result;
            }

            int attemptNumber = recoveryPersistence.recordAttempt(applicationId, paymentIntentId, clock.instant())
                    .getAttemptCount();
            RecoveryResult result = circuitBreakers.execute(OperationClass.RECOVERY,
                    () -> recover(applicationId, paymentIntentId, attemptNumber));
            recordOutcome(result);
            idempotencyService.storeRecoveryResult(applicationId, paymentIntentId, result);
            return result;
        } catch (CallNotPermittedException e) {
            return circuitOpen(applicationId, paymentIntentId);
        } catch (Exception e) {
            log.error("Payment recovery failed: applicationId={}, paymentIntentId={}", applicationId, paymentIntentId, e);
            failedRecoveries.incrementAndGet();
            safeUpdateOutcome(applicationId, paymentIntentId, RecoveryStatus.FAILED, e.getMessage());
            return result(applicationId, paymentIntentId, false, RecoveryResult.RECOVERY_ERROR)
                    .error(e.getMessage())
                    .build();
        }
    }

    private RecoveryResult recover(String applicationId, String paymentIntentId, int attemptNumber) {
        Optional<ProviderPaymentIntent> intent = gatewayClient.retrievePaymentIntent(paymentIntentId);
        if (intent.isEmpty()) {
            log.warn("Payment intent {} not found at the provider (applicationId={})", paymentIntentId, applicationId);
            return result(applicationId, paymentIntentId, false, RecoveryResult.PAYMENT_INTENT_NOT_FOUND).build();
        }
        try {
            return evaluate(applicationId, intent.get(), attemptNumber, true);
        } catch (PaymentConsistencyException e) {
            reportConflict(applicationId, e);
            return result(applicationId, paymentIntentId, false, RecoveryResult.STATUS_CONFLICT)
                    .status(e.getProviderStatus())
                    .error(e.getMessage())
                    .build();
        }
    }

    /**
     * Acts on the provider status.
     *
     * @param mayAct whether confirm or capture may still be attempted; false after one was done
     */
    private RecoveryResult evaluate(String applicationId, ProviderPaymentIntent intent, int attemptNumber, boolean mayAct) {
        String paymentIntentId = intent.getId();
        IntentStatus status = intent.getStatus();
        log.info("Recovery observed paymentIntentId={} status={} (applicationId={}, attempt={})",
                paymentIntentId, status, applicationId, attemptNumber);
        switch (status) {
            case SUCCEEDED:
                return handleSucceeded(applicationId, intent);
            case REQUIRES_CAPTURE:
                return mayAct
                        ? handleRequiresCapture(applicationId, intent, attemptNumber)
                        : result(applicationId, paymentIntentId, false, RecoveryResult.CAPTURE_FAILED)
                                .status(status)
                                .error(intent.getLastPaymentError())
                                .build();
            case REQUIRES_CONFIRMATION:
                return mayAct
                        ? handleRequiresConfirmation(applicationId, intent, attemptNumber)
                        : result(applicationId, paymentIntentId, false, RecoveryResult.CONFIRMATION_FAILED)
                                .status(status)
                                .build();
            case PROCESSING:
                return handleProcessing(applicationId, intent, attemptNumber);
            case REQUIRES_PAYMENT_METHOD:
            case FAILED:
                applyToLocalRecord(intent, IntentStatus.FAILED, SOURCE_RECOVERY);
                statusService.convergeApplication(applicationId, ApplicationStatus.PAYMENT_FAILED);
                return result(applicationId, paymentIntentId, false,
                        status == IntentStatus.FAILED ? RecoveryResult.PAYMENT_FAILED : RecoveryResult.REQUIRES_PAYMENT_METHOD)
                        .status(status)
                        .userAction("retry_payment")
                        .message("El pago requiere un nuevo método de pago. Por favor, intente nuevamente.")
                        .error(intent.getLastPaymentError())
                        .build();
            case REQUIRES_ACTION:
                applyToLocalRecord(intent, IntentStatus.REQUIRES_ACTION, SOURCE_RECOVERY);
                return result(applicationId, paymentIntentId, false, RecoveryResult.REQUIRES_ACTION)
                        .status(status)
                        .userAction("complete_authentication")
                        .message("El pago requiere autenticación adicional. Por favor, complete el proceso.")
                        .build();
            case CANCELED:
                applyToLocalRecord(intent, IntentStatus.CANCELED, SOURCE_RECOVERY);
                statusService.convergeApplication(applicationId, ApplicationStatus.PAYMENT_FAILED);
                return result(applicationId, paymentIntentId, false, RecoveryResult.PAYMENT_CANCELED)
                        .status(status)
                        .userAction("retry_payment")
                        .message("El pago fue cancelado. Por favor, intente nuevamente.")
                        .build();
            default:
                log.warn("Unexpected payment intent status {} during recovery of {}", status, paymentIntentId);
                return result(applicationId, paymentIntentId, false, RecoveryResult.UNEXPECTED_STATUS)
                        .status(status)
                        .build();
        }
    }

    private RecoveryResult handleSucceeded(String applicationId, ProviderPaymentIntent intent) {
        if (applyToLocalRecord(intent, IntentStatus.SUCCEEDED, SOURCE_RECOVERY).isEmpty()) {
            log.warn("No local record for succeeded payment intent {}; updating application {} only",
                    intent.getId(), applicationId);
        }
        statusService.convergeApplication(applicationId, ApplicationStatus.PAYMENT_PROCESSING);
        recheckScheduler.cancel(applicationId, intent.getId());
        log.info("Payment recovered: applicationId={}, paymentIntentId={}", applicationId, intent.getId());
        return result(applicationId, intent.getId(), true, RecoveryResult.PAYMENT_SUCCEEDED)
                .status(IntentStatus.SUCCEEDED)
                .build();
    }

    private RecoveryResult handleRequiresConfirmation(String applicationId, ProviderPaymentIntent intent, int attemptNumber) {
        try {
            log.info("Confirming payment intent {} during recovery (applicationId={})", intent.getId(), applicationId);
            ProviderPaymentIntent confirmed = gatewayClient.confirmPaymentIntent(intent.getId(), methodOf(intent));
            return evaluate(applicationId, confirmed, attemptNumber, false);
        } catch (PaymentConsistencyException e) {
            throw e;
        } catch (Exception e) {
            log.error("Confirmation during recovery failed for paymentIntentId={}", intent.getId(), e);
            return result(applicationId, intent.getId(), false, RecoveryResult.CONFIRMATION_ERROR)
                    .status(intent.getStatus())
                    .error(e.getMessage())
                    .build();
        }
    }

    private RecoveryResult handleRequiresCapture(String applicationId, ProviderPaymentIntent intent, int attemptNumber) {
        Optional<ApplicationStatus> applicationStatus = applicationGateway.findStatus(applicationId);
        if (applicationStatus.isEmpty()) {
            log.error("Application {} not found while handling capture of {}", applicationId, intent.getId());
            return result(applicationId, intent.getId(), false, RecoveryResult.APPLICATION_NOT_FOUND)
                    .status(intent.getStatus())
                    .error("Application not found")
                    .build();
        }

        if (applicationStatus.get().allowsAutomaticCapture()) {
            log.info("Auto-capturing payment intent {} for application {} in status {}",
                    intent.getId(), applicationId, applicationStatus.get());
            ProviderPaymentIntent captured;
            try {
                captured = gatewayClient.capturePaymentIntent(intent.getId(), methodOf(intent));
            } catch (Exception e) {
                log.error("Capture failed for paymentIntentId={}, applicationId={}", intent.getId(), applicationId, e);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("applicationId", applicationId);
                details.put("paymentIntentId", intent.getId());
                details.put("error", e.getMessage());
                alertProducer.send(OperationalAlert.of("Payment Capture Failed",
                        "Failed to capture payment for application " + applicationId, AlertSeverity.HIGH, details));
                return result(applicationId, intent.getId(), false, RecoveryResult.CAPTURE_ERROR)
                        .status(intent.getStatus())
                        .error(e.getMessage())
                        .build();
            }
            return evaluate(applicationId, captured, attemptNumber, false);
        }

        log.info("Application {} in status {} is not eligible for auto-capture; requesting manual review of {}",
                applicationId, applicationStatus.get(), intent.getId());
        applyToLocalRecord(intent, IntentStatus.REQUIRES_CAPTURE, SOURCE_RECOVERY);
        statusService.convergeApplication(applicationId, ApplicationStatus.PAYMENT_PROCESSING);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("applicationId", applicationId);
        details.put("paymentIntentId", intent.getId());
        details.put("applicationStatus", applicationStatus.get().name());
        details.put("amount", intent.getAmount());
        details.put("currency", intent.getCurrency());
        alertProducer.send(OperationalAlert.of("Payment Requires Manual Capture",
                "Payment for application " + applicationId + " requires manual capture review",
                AlertSeverity.MEDIUM, details));
        return result(applicationId, intent.getId(), false, RecoveryResult.REQUIRES_MANUAL_CAPTURE)
                .status(intent.getStatus())
                .userAction("await_admin_review")
                .message("Su pago está siendo revisado por un administrador. Se le notificará cuando se complete el proceso.")
                .build();
    }

    private RecoveryResult handleProcessing(String applicationId, ProviderPaymentIntent intent, int attemptNumber) {
        applyToLocalRecord(intent, IntentStatus.PROCESSING, SOURCE_RECOVERY);
        Duration delay = getRecoveryDelay(attemptNumber);
        String paymentIntentId = intent.getId();
        recheckScheduler.schedule(applicationId, paymentIntentId, delay, () -> {
            idempotencyService.evictRecoveryResult(applicationId, paymentIntentId);
            attemptPaymentRecovery(applicationId, paymentIntentId, Map.of("trigger", "scheduled_recheck"));
        });
        return result(applicationId, paymentIntentId, false, RecoveryResult.STILL_PROCESSING)
                .status(IntentStatus.PROCESSING)
                .nextCheckIn(delay.getSeconds())
                .message("El pago está siendo procesado. Por favor, espere.")
                .build();
    }

    /**
     * Compares the latest local payment of the application with the provider and moves
     * the local status forward when the provider is ahead.
     */
    public ReconciliationResult reconcilePaymentStatus(String applicationId) {
        try {
            if (applicationGateway.findStatus(applicationId).isEmpty()) {
                return ReconciliationResult.builder()
                        .success(false)
                        .reason(ReconciliationResult.RECONCILIATION_ERROR)
                        .applicationId(applicationId)
                        .error("Application not found: " + applicationId)
                        .build();
            }

            Optional<PaymentIntentEntity> record = intentPersistence.findLatestForApplication(applicationId);
            if (record.isEmpty()) {
                log.info("No payment order to reconcile for application {}", applicationId);
                return ReconciliationResult.builder()
                        .success(false)
                        .reason(ReconciliationResult.NO_PAYMENT_ORDER)
                        .applicationId(applicationId)
                        .build();
            }

            PaymentIntentEntity payment = record.get();
            Optional<ProviderPaymentIntent> intent =
                    gatewayClient.retrievePaymentIntent(payment.getPaymentIntentId(), payment.getMethod());
            if (intent.isEmpty()) {
                return ReconciliationResult.builder()
                        .success(false)
                        .reason(ReconciliationResult.PAYMENT_INTENT_NOT_FOUND)
                        .applicationId(applicationId)
                        .paymentIntentId(payment.getPaymentIntentId())
                        .oldStatus(payment.getStatus())
                        .build();
            }

            PaymentStatusService.StatusUpdate update = statusService.applyProviderStatus(payment,
                    intent.get().getStatus(), SOURCE_RECONCILIATION,
                    intent.get().getLastPaymentErrorCode(), intent.get().getLastPaymentError());
            if (!update.isChanged()) {
                intentPersistence.markChecked(payment);
                return ReconciliationResult.builder()
                        .success(true)
                        .reason(ReconciliationResult.STATUS_IN_SYNC)
                        .applicationId(applicationId)
                        .paymentIntentId(payment.getPaymentIntentId())
                        .oldStatus(update.getOldStatus())
                        .newStatus(update.getNewStatus())
                        .build();
            }

            statusService.convergeApplication(applicationId,
                    ApplicationStatus.forIntentStatus(update.getNewStatus(), payment.getMethod()));
            log.info("Reconciled payment {} of application {}: {} -> {}", payment.getPaymentIntentId(),
                    applicationId, update.getOldStatus(), update.getNewStatus());
            return ReconciliationResult.builder()
                    .success(true)
                    .reason(ReconciliationResult.STATUS_UPDATED)
                    .applicationId(applicationId)
                    .paymentIntentId(payment.getPaymentIntentId())
                    .oldStatus(update.getOldStatus())
                    .newStatus(update.getNewStatus())
                    .build();
        } catch (PaymentConsistencyException e) {
            reportConflict(applicationId, e);
            return ReconciliationResult.builder()
                    .success(false)
                    .reason(ReconciliationResult.STATUS_CONFLICT)
                    .applicationId(applicationId)
                    .paymentIntentId(e.getPaymentIntentId())
                    .oldStatus(e.getLocalStatus())
                    .newStatus(e.getProviderStatus())
                    .error(e.getMessage())
                    .build();
        } catch (Exception e) {
            log.error("Reconciliation failed for application {}", applicationId, e);
            return ReconciliationResult.builder()
                    .success(false)
                    .reason(ReconciliationResult.RECONCILIATION_ERROR)
                    .applicationId(applicationId)
                    .error(e.getMessage())
                    .build();
        }
    }

    public RecoveryStatusView getRecoveryStatus(String applicationId, String paymentIntentId) {
        Optional<RecoveryAttemptEntity> attempt = recoveryPersistence.find(applicationId, paymentIntentId);
        int attempts = attempt.map(RecoveryAttemptEntity::getAttemptCount).orElse(0);
        return RecoveryStatusView.builder()
                .applicationId(applicationId)
                .paymentIntentId(paymentIntentId)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .canRetry(attempts < maxAttempts)
                .status(attempt.map(RecoveryAttemptEntity::getRecoveryStatus).orElse(RecoveryStatus.NOT_ATTEMPTED))
                .lastAttemptTime(attempt.map(RecoveryAttemptEntity::getLastAttemptTime).orElse(null))
                .lastError(attempt.map(RecoveryAttemptEntity::getLastError).orElse(null))
                .nextAttemptDelayMs(getRecoveryDelay(attempts + 1).toMillis())
                .build();
    }

    /**
     * Re-check delay after attempt {@code attemptNumber} (1-based). Attempts past the
     * configured table keep doubling its last entry.
     */
    public Duration getRecoveryDelay(int attemptNumber) {
        int index = Math.max(0, attemptNumber - 1);
        if (index < recoveryDelays.size()) {
            return recoveryDelays.get(index);
        }
        Duration last = recoveryDelays.get(recoveryDelays.size() - 1);
        return last.multipliedBy(1L << Math.min(20, index - recoveryDelays.size() + 1));
    }

    public Map<String, Long> getMetrics() {
        Map<String, Long> metrics = new LinkedHashMap<>();
        metrics.put("recoveryAttempts", recoveryAttempts.get());
        metrics.put("successfulRecoveries", successfulRecoveries.get());
        metrics.put("failedRecoveries", failedRecoveries.get());
        metrics.put("circuitBreakerTrips", circuitBreakerTrips.get());
        return metrics;
    }

    /** Recovery attempt counts by status over the last {@code hours} hours. */
    public Map<RecoveryStatus, Long> getRecoveryStatistics(int hours) {
        return recoveryPersistence.countByStatusSince(clock.instant().minus(Math.max(1, hours), ChronoUnit.HOURS));
    }

    private void recordOutcome(RecoveryResult result) {
        if (result.isSuccess()) {
            successfulRecoveries.incrementAndGet();
            recoveryPersistence.updateOutcome(result.getApplicationId(), result.getPaymentIntentId(),
                    RecoveryStatus.SUCCEEDED, null);
        } else if (RecoveryResult.STILL_PROCESSING.equals(result.getReason())) {
            recoveryPersistence.updateOutcome(result.getApplicationId(), result.getPaymentIntentId(),
                    RecoveryStatus.RECOVERING, null);
        } else {
            failedRecoveries.incrementAndGet();
            recoveryPersistence.updateOutcome(result.getApplicationId(), result.getPaymentIntentId(),
                    RecoveryStatus.FAILED, result.getError() != null ? result.getError() : result.getReason());
        }
    }

    private RecoveryResult circuitOpen(String applicationId, String paymentIntentId) {
        circuitBreakerTrips.incrementAndGet();
        log.warn("Recovery circuit breaker open; skipping applicationId={}, paymentIntentId={}",
                applicationId, paymentIntentId);
        return result(applicationId, paymentIntentId, false, RecoveryResult.CIRCUIT_BREAKER_OPEN).build();
    }

    private Optional<PaymentIntentEntity> applyToLocalRecord(ProviderPaymentIntent intent, IntentStatus status, String source) {
        Optional<PaymentIntentEntity> record = intentPersistence.findByPaymentIntentId(intent.getId());
        record.ifPresent(r -> statusService.applyProviderStatus(r, status, source,
                intent.getLastPaymentErrorCode(), intent.getLastPaymentError()));
        return record;
    }

    private PaymentMethod methodOf(ProviderPaymentIntent intent) {
        return intentPersistence.findByPaymentIntentId(intent.getId())
                .map(PaymentIntentEntity::getMethod)
                .orElse(PaymentMethod.CARD);
    }

    private void reportConflict(String applicationId, PaymentConsistencyException e) {
        log.error("Payment state conflict for application {}: {}", applicationId, e.getMessage());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("applicationId", applicationId);
        details.put("paymentIntentId", e.getPaymentIntentId());
        details.put("localStatus", String.valueOf(e.getLocalStatus()));
        details.put("providerStatus", String.valueOf(e.getProviderStatus()));
        alertProducer.send(OperationalAlert.of("Payment Status Conflict",
                "Local and provider status disagree for application " + applicationId,
                AlertSeverity.HIGH, details));
    }

    private void safeUpdateOutcome(String applicationId, String paymentIntentId, RecoveryStatus status, String error) {
        try {
            recoveryPersistence.updateOutcome(applicationId, paymentIntentId, status, error);
        } catch (Exception e) {
            log.error("Could not record recovery outcome {} for applicationId={}, paymentIntentId={}",
                    status, applicationId, paymentIntentId, e);
        }
    }

    private RecoveryResult.RecoveryResultBuilder result(String applicationId, String paymentIntentId,
                                                        boolean success, String reason) {
        return RecoveryResult.builder()
                .success(success)
                .reason(reason)
                .applicationId(applicationId)
                .paymentIntentId(paymentIntentId)
                .timestamp(clock.instant());
    }
}
