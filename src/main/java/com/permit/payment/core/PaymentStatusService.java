package com.permit.payment.core;

import com.permit.payment.api.PaymentConsistencyException;
import com.permit.payment.application.PermitApplicationGateway;
import com.permit.payment.compliance.PaymentAuditLogger;
import com.permit.payment.domain.ApplicationStatus;
import com.permit.payment.domain.IntentStatus;
import com.permit.payment.messaging.PaymentEventProducer;
import com.permit.payment.persistence.entity.PaymentIntentEntity;
import com.permit.payment.persistence.service.PaymentIntentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Single place where provider observations are written to local state. Every write
 * is read-then-conditional-write following {@link IntentStatus#shouldAdvanceTo}:
 * terminal records are never moved back by a late non-terminal observation,
 * SUCCEEDED always converges, and a terminal/terminal disagreement raises
 * {@link PaymentConsistencyException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentStatusService {

    private final PaymentIntentPersistenceService intentPersistence;
    private final PermitApplicationGateway applicationGateway;
    private final PaymentEventProducer eventProducer;
    private final PaymentAuditLogger auditLogger;

    /**
     * Applies an observed provider status to the local record.
     *
     * @param source      what observed the status, e.g. "webhook" or "recovery"
     * @param failureCode provider error code of the last payment attempt; kept only
     *                    when the payment fails or is canceled
     */
    public StatusUpdate applyProviderStatus(PaymentIntentEntity record, IntentStatus observed,
                                            String source, String failureCode, String failureMessage) {
        IntentStatus current = record.getStatus();
        if (current.conflictsWith(observed)) {
            log.error("Payment status conflict: paymentIntentId={}, local={}, provider={}, source={}",
                    record.getPaymentIntentId(), current, observed, source);
            throw new PaymentConsistencyException(record.getPaymentIntentId(), current, observed);
        }
        if (!current.shouldAdvanceTo(observed)) {
            if (current != observed) {
                log.info("Ignoring {} observation for payment {} already {} (source={})",
                        observed, record.getPaymentIntentId(), current, source);
            }
            return new StatusUpdate(false, current, current);
        }

        record.setStatus(observed);
        if (observed == IntentStatus.FAILED || observed == IntentStatus.CANCELED) {
            record.setFailureCode(failureCode != null ? failureCode : defaultFailureCode(observed));
            record.setFailureMessage(failureMessage);
        }
        PaymentIntentEntity saved = intentPersistence.save(record);
        auditLogger.logStatusChange(saved.getApplicationId(), saved.getPaymentIntentId(), current, observed, source);
        if (observed.isTerminal()) {
            eventProducer.publishOutcome(saved, source);
        }
        return new StatusUpdate(true, current, observed);
    }

    private static String defaultFailureCode(IntentStatus observed) {
        return observed == IntentStatus.CANCELED ? "payment_intent_canceled" : "payment_failed";
    }

    /**
     * Moves the application to {@code target} unless it already progressed past
     * payment and {@code target} would move it back.
     */
    public void convergeApplication(String applicationId, ApplicationStatus target) {
        Optional<ApplicationStatus> current = applicationGateway.findStatus(applicationId);
        if (current.isEmpty()) {
            log.warn("Application {} not found; cannot set status {}", applicationId, target);
            return;
        }
        ApplicationStatus status = current.get();
        if (status == target) {
            return;
        }
        if (status.isPastPayment() && !target.isPastPayment()) {
            log.info("Application {} is {}; not moving it back to {}", applicationId, status, target);
            return;
        }
        applicationGateway.updateStatus(applicationId, target);
    }

    @Value
    public static class StatusUpdate {
        boolean changed;
        IntentStatus oldStatus;
        IntentStatus newStatus;
    }
}
