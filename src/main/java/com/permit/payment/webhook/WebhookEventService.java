package com.permit.payment.webhook;

import com.permit.payment.api.PaymentConsistencyException;
import com.permit.payment.core.PaymentCircuitBreakers;
import com.permit.payment.core.PaymentGatewayClient;
import com.permit.payment.core.PaymentStatusService;
import com.permit.payment.domain.AlertSeverity;
import com.permit.payment.domain.ApplicationStatus;
import com.permit.payment.domain.IntentStatus;
import com.permit.payment.domain.OperationClass;
import com.permit.payment.domain.WebhookEvent;
import com.permit.payment.messaging.AlertProducer;
import com.permit.payment.messaging.OperationalAlert;
import com.permit.payment.persistence.entity.PaymentIntentEntity;
import com.permit.payment.persistence.entity.WebhookEventEntity;
import com.permit.payment.persistence.service.PaymentIntentPersistenceService;
import com.permit.payment.persistence.service.WebhookEventPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Applies verified provider webhooks to local state exactly once per event id.
 * <p>
 * Each delivery is first recorded; an event already processed (or permanently failed)
 * is acknowledged as a duplicate. Processing runs in one transaction behind the
 * webhook-processing breaker. A failure never reaches the provider: it is persisted
 * and handed to {@link WebhookRetryScheduler}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookEventService {

    public enum Outcome {
        PROCESSED,
        DUPLICATE,
        IGNORED,
        RETRY_SCHEDULED,
        CONFLICT
    }

    private static final String SOURCE = "webhook";

    private final WebhookEventPersistenceService webhookPersistence;
    private final PaymentIntentPersistenceService intentPersistence;
    private final PaymentStatusService statusService;
    private final PaymentCircuitBreakers circuitBreakers;
    private final WebhookRetryScheduler retryScheduler;
    private final PaymentGatewayClient gatewayClient;
    private final AlertProducer alertProducer;
    private final TransactionOperations transactionOperations;

    public Outcome handle(WebhookEvent event) {
        WebhookEventEntity record = webhookPersistence.recordReceived(event);
        if (record.getProcessingStatus().isFinal()) {
            log.info("Duplicate webhook event {} ({}) already {}; skipping",
                    event.getEventId(), event.getType(), record.getProcessingStatus());
            return Outcome.DUPLICATE;
        }

        try {
            boolean applied = circuitBreakers.execute(OperationClass.WEBHOOK_PROCESSING,
                    () -> transactionOperations.execute(status -> apply(event)));
            webhookPersistence.markProcessed(event.getEventId());
            retryScheduler.cancelRetry(event.getEventId());
            return applied ? Outcome.PROCESSED : Outcome.IGNORED;
        } catch (PaymentConsistencyException e) {
            reportConflict(event, e);
            return Outcome.CONFLICT;
        } catch (Exception e) {
            log.error("Webhook event {} ({}) failed; scheduling retry: {}",
                    event.getEventId(), event.getType(), e.getMessage(), e);
            webhookPersistence.markFailed(event.getEventId(), e.getMessage(), 0);
            String eventId = event.getEventId();
            retryScheduler.scheduleRetry(eventId, 0, () -> reprocess(eventId));
            return Outcome.RETRY_SCHEDULED;
        }
    }

    /**
     * Re-runs a stored event. Called by the retry scheduler inside its transaction;
     * any exception counts as a failed attempt.
     */
    void reprocess(String eventId) {
        Optional<WebhookEventEntity> record = webhookPersistence.find(eventId);
        if (record.isEmpty()) {
            log.warn("Webhook event {} disappeared before its retry", eventId);
            return;
        }
        if (record.get().getProcessingStatus().isFinal()) {
            log.info("Webhook event {} already {}; nothing to retry", eventId, record.get().getProcessingStatus());
            return;
        }
        WebhookEvent event = gatewayClient.parseWebhookEvent(record.get().getPayload());
        try {
            circuitBreakers.execute(OperationClass.WEBHOOK_PROCESSING, () -> apply(event));
        } catch (PaymentConsistencyException e) {
            reportConflict(event, e);
            return;
        }
        webhookPersistence.markProcessed(eventId);
    }

    /**
     * Applies one event. Returns false when the event needs no action.
     *
     * @throws IllegalStateException when the intent belongs to an application but has no local record yet
     */
    private boolean apply(WebhookEvent event) {
        Optional<IntentStatus> observed = statusFor(event);
        if (observed.isEmpty()) {
            log.info("Webhook event {} of type {} needs no action", event.getEventId(), event.getType());
            return false;
        }

        Optional<PaymentIntentEntity> record = intentPersistence.findByPaymentIntentId(event.getPaymentIntentId());
        if (record.isEmpty()) {
            if (event.getApplicationId() == null) {
                log.info("Webhook event {} refers to payment intent {} not created here; ignoring",
                        event.getEventId(), event.getPaymentIntentId());
                return false;
            }
            throw new IllegalStateException("No local record for payment intent " + event.getPaymentIntentId());
        }

        PaymentIntentEntity intent = record.get();
        PaymentStatusService.StatusUpdate update =
                statusService.applyProviderStatus(intent, observed.get(), SOURCE,
                        event.getLastPaymentErrorCode(), event.getLastPaymentError());
        statusService.convergeApplication(intent.getApplicationId(),
                ApplicationStatus.forIntentStatus(update.getNewStatus(), intent.getMethod()));
        log.info("Webhook event {} applied: paymentIntentId={}, applicationId={}, {} -> {}",
                event.getEventId(), intent.getPaymentIntentId(), intent.getApplicationId(),
                update.getOldStatus(), update.getNewStatus());
        return true;
    }

    private void reportConflict(WebhookEvent event, PaymentConsistencyException e) {
        log.error("Webhook event {} conflicts with local payment state: {}", event.getEventId(), e.getMessage());
        webhookPersistence.markFailedPermanent(event.getEventId(), "status_conflict: " + e.getMessage());
        retryScheduler.cancelRetry(event.getEventId());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("eventId", event.getEventId());
        details.put("paymentIntentId", e.getPaymentIntentId());
        details.put("localStatus", String.valueOf(e.getLocalStatus()));
        details.put("providerStatus", String.valueOf(e.getProviderStatus()));
        alertProducer.send(OperationalAlert.of("Payment Status Conflict",
                "Webhook " + event.getEventId() + " reports a status that conflicts with the local record",
                AlertSeverity.HIGH, details));
    }

    static Optional<IntentStatus> statusFor(WebhookEvent event) {
        if (event.getType() == null || event.getPaymentIntentId() == null) {
            return Optional.empty();
        }
        switch (event.getType()) {
            case WebhookEvent.PAYMENT_INTENT_SUCCEEDED:
                return Optional.of(IntentStatus.SUCCEEDED);
            case WebhookEvent.PAYMENT_INTENT_FAILED:
                return Optional.of(IntentStatus.FAILED);
            case WebhookEvent.PAYMENT_INTENT_CANCELED:
                return Optional.of(IntentStatus.CANCELED);
            case WebhookEvent.PAYMENT_INTENT_PROCESSING:
                return Optional.of(IntentStatus.PROCESSING);
            case WebhookEvent.PAYMENT_INTENT_REQUIRES_ACTION:
                return Optional.of(IntentStatus.REQUIRES_ACTION);
            default:
                return Optional.empty();
        }
    }
}
