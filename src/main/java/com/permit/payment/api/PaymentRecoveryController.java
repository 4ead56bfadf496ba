package com.permit.payment.api;

import com.permit.payment.core.PaymentCircuitBreakers;
import com.permit.payment.core.PaymentMetrics;
import com.permit.payment.domain.ReconciliationResult;
import com.permit.payment.domain.RecoveryResult;
import com.permit.payment.domain.RecoveryStatusView;
import com.permit.payment.domain.WebhookProcessingStatus;
import com.permit.payment.persistence.service.WebhookEventPersistenceService;
import com.permit.payment.recovery.PaymentRecoveryService;
import com.permit.payment.recovery.RecoveryCheckScheduler;
import com.permit.payment.webhook.WebhookRetryScheduler;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Operator endpoints: manual reconciliation and recovery, plus the statistics shown
 * on the payments dashboard.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payment recovery", description = "Reconcile payments with the provider and inspect reliability state")
public class PaymentRecoveryController {

    private final PaymentRecoveryService recoveryService;
    private final PaymentCircuitBreakers circuitBreakers;
    private final WebhookRetryScheduler webhookRetryScheduler;
    private final RecoveryCheckScheduler recoveryCheckScheduler;
    private final WebhookEventPersistenceService webhookPersistence;
    private final PaymentMetrics paymentMetrics;

    @PostMapping("/recovery/{applicationId}/reconcile")
    @Operation(summary = "Reconcile payment status",
            description = "Compares the latest payment of the application with the provider and moves the local status forward if needed.")
    public ResponseEntity<ReconciliationResult> reconcile(@PathVariable String applicationId) {
        log.info("Manual reconciliation requested for application {}", applicationId);
        return ResponseEntity.ok(recoveryService.reconcilePaymentStatus(applicationId));
    }

    @PostMapping("/recovery/{applicationId}/attempt")
    @Operation(summary = "Attempt payment recovery",
            description = "Runs one guarded recovery attempt for the payment intent. Results are cached briefly, so concurrent triggers do not reach the provider twice.")
    public ResponseEntity<RecoveryResult> attempt(@PathVariable String applicationId,
                                                  @RequestParam String paymentIntentId) {
        return ResponseEntity.ok(recoveryService.attemptPaymentRecovery(applicationId, paymentIntentId,
                Map.of("trigger", "manual")));
    }

    @GetMapping("/recovery/{applicationId}/status")
    @Operation(summary = "Recovery status", description = "Attempts so far, whether another attempt is allowed, and its delay.")
    public ResponseEntity<RecoveryStatusView> status(@PathVariable String applicationId,
                                                     @RequestParam String paymentIntentId) {
        return ResponseEntity.ok(recoveryService.getRecoveryStatus(applicationId, paymentIntentId));
    }

    @GetMapping("/health/stats")
    @Operation(summary = "Reliability statistics",
            description = "Recovery metrics, circuit breaker states, webhook retry state and per-method payment metrics.")
    public ResponseEntity<Map<String, Object>> stats(@RequestParam(defaultValue = "24") int hours) {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("recovery", recoveryService.getMetrics());
        stats.put("recoveryByStatus", recoveryService.getRecoveryStatistics(hours));
        stats.put("pendingRecoveryChecks", recoveryCheckScheduler.getPendingCount());
        stats.put("circuitBreakers", circuitBreakers.getStates());
        stats.put("webhookRetries", webhookRetryScheduler.getRetryStats());
        Map<WebhookProcessingStatus, Long> webhookEvents = new EnumMap<>(WebhookProcessingStatus.class);
        for (WebhookProcessingStatus status : WebhookProcessingStatus.values()) {
            webhookEvents.put(status, webhookPersistence.countByStatus(status));
        }
        stats.put("webhookEvents", webhookEvents);
        stats.put("payments", paymentMetrics.getAllStats());
        return ResponseEntity.ok(stats);
    }
}
