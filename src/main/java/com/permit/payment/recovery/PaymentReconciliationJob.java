package com.permit.payment.recovery;

import com.permit.payment.domain.ReconciliationResult;
import com.permit.payment.domain.RecoveryResult;
import com.permit.payment.persistence.entity.PaymentIntentEntity;
import com.permit.payment.persistence.entity.RecoveryAttemptEntity;
import com.permit.payment.persistence.service.PaymentIntentPersistenceService;
import com.permit.payment.persistence.service.RecoveryAttemptPersistenceService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Periodic sweep for payments that went quiet: reconciles non-terminal payments not
 * updated for a while, then retries recoveries stuck in {@code recovering}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "payment.recovery.sweep.enabled", havingValue = "true", matchIfMissing = true)
public class PaymentReconciliationJob {

    private final PaymentRecoveryService recoveryService;
    private final PaymentIntentPersistenceService intentPersistence;
    private final RecoveryAttemptPersistenceService recoveryPersistence;
    private final Clock clock;
    private final Duration stuckAfter;
    private final Duration stuckRecoveryAfter;
    private final int batchSize;
    private final Duration pause;

    public PaymentReconciliationJob(PaymentRecoveryService recoveryService,
                                    PaymentIntentPersistenceService intentPersistence,
                                    RecoveryAttemptPersistenceService recoveryPersistence,
                                    Clock clock,
                                    @Value("${payment.recovery.sweep.stuck-after:1h}") Duration stuckAfter,
                                    @Value("${payment.recovery.sweep.stuck-recovery-after:30m}") Duration stuckRecoveryAfter,
                                    @Value("${payment.recovery.sweep.batch-size:50}") int batchSize,
                                    @Value("${payment.recovery.sweep.pause:100ms}") Duration pause) {
        this.recoveryService = recoveryService;
        this.intentPersistence = intentPersistence;
        this.recoveryPersistence = recoveryPersistence;
        this.clock = clock;
        this.stuckAfter = stuckAfter;
        this.stuckRecoveryAfter = stuckRecoveryAfter;
        this.batchSize = batchSize;
        this.pause = pause;
    }

    @Scheduled(cron = "${payment.recovery.sweep.cron:0 */15 * * * *}")
    public void scheduledSweep() {
        try {
            run();
        } catch (Exception e) {
            log.error("Payment reconciliation sweep failed", e);
        }
    }

    public SweepSummary run() {
        long start = clock.millis();
        int processed = 0;
        int successful = 0;
        int failed = 0;
        log.info("Starting payment reconciliation sweep");

        Instant now = clock.instant();
        List<PaymentIntentEntity> stuckPayments = intentPersistence.findStuck(now.minus(stuckAfter), batchSize);
        log.info("Found {} stuck payments to reconcile", stuckPayments.size());
        for (PaymentIntentEntity payment : stuckPayments) {
            processed++;
            ReconciliationResult result = recoveryService.reconcilePaymentStatus(payment.getApplicationId());
            if (result.isSuccess()) {
                successful++;
                log.info("Reconciled applicationId={}: {} ({} -> {})", payment.getApplicationId(),
                        result.getReason(), result.getOldStatus(), result.getNewStatus());
            } else {
                failed++;
                log.warn("Could not reconcile applicationId={}: reason={}, error={}",
                        payment.getApplicationId(), result.getReason(), result.getError());
            }
            if (!pause()) {
                break;
            }
        }

        List<RecoveryAttemptEntity> stuckRecoveries =
                recoveryPersistence.findStuckRecovering(now.minus(stuckRecoveryAfter), batchSize);
        log.info("Found {} stuck recovery attempts", stuckRecoveries.size());
        for (RecoveryAttemptEntity attempt : stuckRecoveries) {
            processed++;
            RecoveryResult result = recoveryService.attemptPaymentRecovery(attempt.getApplicationId(),
                    attempt.getPaymentIntentId(), Map.of("trigger", "scheduled_sweep"));
            if (result.isSuccess()) {
                successful++;
            } else if (RecoveryResult.STILL_PROCESSING.equals(result.getReason())) {
                log.info("Payment still processing for applicationId={}", attempt.getApplicationId());
            } else {
                failed++;
                log.warn("Recovery retry failed for applicationId={}: reason={}",
                        attempt.getApplicationId(), result.getReason());
            }
            if (!pause()) {
                break;
            }
        }

        SweepSummary summary = new SweepSummary(processed, successful, failed, clock.millis() - start);
        log.info("Payment reconciliation sweep completed: processed={}, successful={}, failed={}, duration={}ms",
                summary.getProcessed(), summary.getSuccessful(), summary.getFailed(), summary.getDurationMs());
        log.info("Payment recovery statistics (last 24h): {}", recoveryService.getRecoveryStatistics(24));
        return summary;
    }

    /** Throttles provider calls; false when the thread was interrupted. */
    private boolean pause() {
        if (pause.isZero() || pause.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(pause.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Payment reconciliation sweep interrupted");
            return false;
        }
    }

    @lombok.Value
    public static class SweepSummary {
        int processed;
        int successful;
        int failed;
        long durationMs;
    }
}
