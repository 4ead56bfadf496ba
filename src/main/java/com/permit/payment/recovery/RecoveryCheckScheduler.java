package com.permit.payment.recovery;

import com.permit.payment.core.IdempotencyService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Pending recovery re-checks for payments still processing at the provider.
 * One re-check per (application, intent); scheduling again replaces it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecoveryCheckScheduler {

    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Map<String, PendingCheck> pendingChecks = new ConcurrentHashMap<>();

    public void schedule(String applicationId, String paymentIntentId, Duration delay, Runnable check) {
        String key = IdempotencyService.recoveryKey(applicationId, paymentIntentId);
        // registered before scheduling so a task firing immediately still finds its entry
        PendingCheck pending = new PendingCheck();
        PendingCheck previous = pendingChecks.put(key, pending);
        if (previous != null) {
            previous.cancel();
        }
        pending.attach(taskScheduler.schedule(() -> {
            pendingChecks.remove(key, pending);
            try {
                check.run();
            } catch (Exception e) {
                log.error("Recovery re-check failed for applicationId={}, paymentIntentId={}",
                        applicationId, paymentIntentId, e);
            }
        }, clock.instant().plus(delay)));
        log.info("Recovery re-check for applicationId={}, paymentIntentId={} in {}s",
                applicationId, paymentIntentId, delay.getSeconds());
    }

    public void cancel(String applicationId, String paymentIntentId) {
        PendingCheck pending = pendingChecks.remove(IdempotencyService.recoveryKey(applicationId, paymentIntentId));
        if (pending != null) {
            pending.cancel();
        }
    }

    @PreDestroy
    public void cancelAll() {
        int count = pendingChecks.size();
        pendingChecks.forEach((key, pending) -> pending.cancel());
        pendingChecks.clear();
        if (count > 0) {
            log.info("Cancelled {} pending recovery re-checks", count);
        }
    }

    public int getPendingCount() {
        return pendingChecks.size();
    }

    /** A scheduled re-check whose future may be attached after it was registered. */
    private static final class PendingCheck {

        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;

        void attach(ScheduledFuture<?> scheduled) {
            future = scheduled;
            if (cancelled) {
                scheduled.cancel(false);
            }
        }

        void cancel() {
            cancelled = true;
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
