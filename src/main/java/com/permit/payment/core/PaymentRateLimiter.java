package com.permit.payment.core;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sliding-window limit on payment attempts per (customer, application). Throughput
 * protection for the provider, separate from velocity/fraud screening.
 */
@Slf4j
@Service
public class PaymentRateLimiter {

    private final Map<String, CopyOnWriteArrayList<Long>> attemptsByKey = new ConcurrentHashMap<>();
    private final Clock clock;

    @Value("${payment.rate-limit.max-attempts:3}")
    private int maxAttempts = 3;

    @Value("${payment.rate-limit.window:10m}")
    private Duration window = Duration.ofMinutes(10);

    public PaymentRateLimiter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Records the attempt if it fits in the window. Returns false, without recording,
     * when the limit is already reached.
     */
    public boolean tryAcquire(String customerId, String applicationId) {
        long now = clock.millis();
        long cutoff = now - window.toMillis();
        AtomicBoolean allowed = new AtomicBoolean();
        attemptsByKey.compute(customerId + ":" + applicationId, (key, attempts) -> {
            CopyOnWriteArrayList<Long> live = attempts != null ? attempts : new CopyOnWriteArrayList<>();
            live.removeIf(ts -> ts <= cutoff);
            if (live.size() >= maxAttempts) {
                log.warn("Payment rate limit reached: customerId={}, applicationId={}, attempts={}, window={}",
                        customerId, applicationId, live.size(), window);
            } else {
                live.add(now);
                allowed.set(true);
            }
            return live.isEmpty() ? null : live;
        });
        return allowed.get();
    }

    /** Drops keys whose attempts have all left the window. */
    @Scheduled(fixedDelayString = "${payment.rate-limit.cleanup-interval:5m}")
    public void evictExpired() {
        long cutoff = clock.millis() - window.toMillis();
        int before = attemptsByKey.size();
        for (String key : attemptsByKey.keySet()) {
            attemptsByKey.computeIfPresent(key, (k, attempts) -> {
                attempts.removeIf(ts -> ts <= cutoff);
                return attempts.isEmpty() ? null : attempts;
            });
        }
        int evicted = before - attemptsByKey.size();
        if (evicted > 0) {
            log.debug("Evicted {} idle rate limit keys", evicted);
        }
    }

    int getTrackedKeyCount() {
        return attemptsByKey.size();
    }

    /** Time until the oldest attempt in the window expires. */
    public Duration retryAfter(String customerId, String applicationId) {
        CopyOnWriteArrayList<Long> attempts = attemptsByKey.get(customerId + ":" + applicationId);
        if (attempts == null) {
            return Duration.ZERO;
        }
        OptionalLong oldestAttempt = attempts.stream().mapToLong(Long::longValue).min();
        if (oldestAttempt.isEmpty()) {
            return Duration.ZERO;
        }
        long oldest = oldestAttempt.getAsLong();
        long remaining = oldest + window.toMillis() - clock.millis();
        return Duration.ofMillis(Math.max(0, remaining));
    }
}
