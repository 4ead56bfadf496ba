package com.permit.payment.webhook;

import com.permit.payment.domain.AlertSeverity;
import com.permit.payment.messaging.AlertProducer;
import com.permit.payment.messaging.OperationalAlert;
import com.permit.payment.persistence.service.WebhookEventPersistenceService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Retries failed webhook processing on a fixed backoff table.
 * <p>
 * The scheduler owns the whole retry chain: a failed execution is persisted as
 * {@code failed} and the next attempt is scheduled here. Once the attempt number
 * reaches {@code maxRetries} the event is marked {@code failed_permanent} and one
 * HIGH alert is raised. At most one retry is pending per event; scheduling again
 * replaces the pending one.
 */
@Slf4j
@Component
public class WebhookRetryScheduler {

    static final String MAX_RETRIES_EXCEEDED = "Max retries exceeded";

    private final TaskScheduler taskScheduler;
    private final WebhookEventPersistenceService webhookPersistence;
    private final AlertProducer alertProducer;
    private final TransactionOperations transactionOperations;
    private final Clock clock;
    private final int maxRetries;
    private final List<Duration> retryDelays;
    private final Map<String, ScheduledFuture<?>> pendingRetries = new ConcurrentHashMap<>();

    public WebhookRetryScheduler(TaskScheduler taskScheduler,
                                 WebhookEventPersistenceService webhookPersistence,
                                 AlertProducer alertProducer,
                                 TransactionOperations transactionOperations,
                                 Clock clock,
                                 @Value("${payment.webhook.max-retries:3}") int maxRetries,
                                 @Value("${payment.webhook.retry-delays:60s,300s,900s}") Duration[] retryDelays) {
        if (retryDelays == null || retryDelays.length == 0) {
            throw new IllegalArgumentException("payment.webhook.retry-delays must not be empty");
        }
        this.taskScheduler = taskScheduler;
        this.webhookPersistence = webhookPersistence;
        this.alertProducer = alertProducer;
        this.transactionOperations = transactionOperations;
        this.clock = clock;
        this.maxRetries = maxRetries;
        this.retryDelays = List.copyOf(Arrays.asList(retryDelays));
        log.info("Webhook retry scheduler configured: maxRetries={}, retryDelays={}", maxRetries, this.retryDelays);
    }

    /**
     * Schedules attempt {@code attemptNumber} of {@code processFn} for the event, or
     * marks the event permanently failed when no attempts are left.
     *
     * @param processFn reprocesses the event; any exception counts as a failed attempt
     */
    public void scheduleRetry(String eventId, int attemptNumber, Runnable processFn) {
        if (attemptNumber >= maxRetries) {
            log.warn("Webhook event {} reached max retries ({}); marking as failed permanently", eventId, maxRetries);
            cancelRetry(eventId);
            markAsFailed(eventId, MAX_RETRIES_EXCEEDED);
            return;
        }

        Duration delay = getRetryDelay(attemptNumber);
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
        ScheduledFuture<?> future = taskScheduler.schedule(
                () -> execute(eventId, attemptNumber, processFn, self.get()),
                clock.instant().plus(delay));
        self.set(future);

        ScheduledFuture<?> previous = pendingRetries.put(eventId, future);
        if (previous != null && previous != future) {
            previous.cancel(false);
            log.debug("Replaced pending retry for webhook event {}", eventId);
        }
        log.info("Scheduled retry {} for webhook event {} in {}s", attemptNumber + 1, eventId, delay.getSeconds());
    }

    private void execute(String eventId, int attemptNumber, Runnable processFn, ScheduledFuture<?> future) {
        if (future != null) {
            pendingRetries.remove(eventId, future);
        }
        log.info("Executing retry {} for webhook event {}", attemptNumber + 1, eventId);
        try {
            transactionOperations.executeWithoutResult(status -> processFn.run());
            log.info("Webhook event {} processed on retry {}", eventId, attemptNumber + 1);
        } catch (Exception e) {
            int nextAttempt = attemptNumber + 1;
            log.error("Retry {} failed for webhook event {}: {}", nextAttempt, eventId, e.getMessage(), e);
            try {
                webhookPersistence.markFailed(eventId, describe(e), nextAttempt);
            } catch (Exception persistError) {
                log.error("Could not record failed retry for webhook event {}", eventId, persistError);
            }
            scheduleRetry(eventId, nextAttempt, processFn);
        }
    }

    /** Cancels the pending retry of the event, if any. */
    public void cancelRetry(String eventId) {
        ScheduledFuture<?> future = pendingRetries.remove(eventId);
        if (future != null) {
            future.cancel(false);
            log.info("Cancelled pending retry for webhook event {}", eventId);
        }
    }

    @PreDestroy
    public void clearAllRetries() {
        int count = pendingRetries.size();
        pendingRetries.forEach((eventId, future) -> future.cancel(false));
        pendingRetries.clear();
        if (count > 0) {
            log.info("Cleared {} pending webhook retries", count);
        }
    }

    public Map<String, Object> getRetryStats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("pendingRetries", pendingRetries.size());
        stats.put("maxRetries", maxRetries);
        stats.put("retryDelays", retryDelays.stream().map(Duration::toMillis).collect(Collectors.toList()));
        return stats;
    }

    /**
     * Persists {@code failed_permanent} and raises a HIGH alert, once per event.
     * Persistence and alerting errors are logged and never propagated.
     */
    public void markAsFailed(String eventId, String reason) {
        boolean newlyFailed;
        try {
            newlyFailed = webhookPersistence.markFailedPermanent(eventId, reason);
        } catch (Exception e) {
            log.error("Could not mark webhook event {} as failed permanently", eventId, e);
            newlyFailed = true;
        }
        if (!newlyFailed) {
            return;
        }
        try {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("eventId", eventId);
            details.put("reason", reason);
            details.put("maxRetries", maxRetries);
            alertProducer.send(OperationalAlert.of(
                    "Webhook Processing Failed Permanently",
                    "Webhook " + eventId + " failed after " + maxRetries + " retries",
                    AlertSeverity.HIGH,
                    details));
        } catch (Exception e) {
            log.error("Could not raise alert for permanently failed webhook event {}", eventId, e);
        }
    }

    /** Delay before attempt {@code attemptNumber}; numbers past the table reuse its last entry. */
    public Duration getRetryDelay(int attemptNumber) {
        int index = Math.max(0, Math.min(attemptNumber, retryDelays.size() - 1));
        return retryDelays.get(index);
    }

    int pendingCount() {
        return pendingRetries.size();
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
