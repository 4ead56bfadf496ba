package com.permit.payment.core;

import com.permit.payment.domain.PaymentMethod;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory payment metrics per method: attempts, successes, failures by code and
 * average processing latency. Thread-safe, per instance.
 */
@Slf4j
@Component
public class PaymentMetrics {

    private final Map<PaymentMethod, MethodMetrics> metrics = new ConcurrentHashMap<>();

    public void recordAttempt(PaymentMethod method) {
        metricsFor(method).attempts.incrementAndGet();
    }

    public void recordSuccess(PaymentMethod method, long latencyMs) {
        MethodMetrics m = metricsFor(method);
        m.successes.incrementAndGet();
        m.totalLatencyMs.addAndGet(latencyMs);
        log.debug("Recorded payment success method={}, latency={}ms", method, latencyMs);
    }

    public void recordFailure(PaymentMethod method, String reason) {
        MethodMetrics m = metricsFor(method);
        m.failures.incrementAndGet();
        m.failuresByReason.computeIfAbsent(reason != null ? reason : "unknown", k -> new AtomicInteger())
                .incrementAndGet();
        log.debug("Recorded payment failure method={}, reason={}", method, reason);
    }

    public MethodStats getStats(PaymentMethod method) {
        MethodMetrics m = metrics.get(method);
        if (m == null) {
            return new MethodStats(method, 0, 0, 0, 0L, Map.of());
        }
        int successes = m.successes.get();
        Map<String, Integer> byReason = new TreeMap<>();
        m.failuresByReason.forEach((reason, count) -> byReason.put(reason, count.get()));
        return new MethodStats(method, m.attempts.get(), successes, m.failures.get(),
                successes == 0 ? 0L : m.totalLatencyMs.get() / successes, byReason);
    }

    public Map<PaymentMethod, MethodStats> getAllStats() {
        Map<PaymentMethod, MethodStats> all = new EnumMap<>(PaymentMethod.class);
        for (PaymentMethod method : PaymentMethod.values()) {
            all.put(method, getStats(method));
        }
        return all;
    }

    private MethodMetrics metricsFor(PaymentMethod method) {
        return metrics.computeIfAbsent(method, k -> new MethodMetrics());
    }

    private static class MethodMetrics {
        private final AtomicInteger attempts = new AtomicInteger();
        private final AtomicInteger successes = new AtomicInteger();
        private final AtomicInteger failures = new AtomicInteger();
        private final AtomicLong totalLatencyMs = new AtomicLong();
        private final Map<String, AtomicInteger> failuresByReason = new ConcurrentHashMap<>();
    }

    @Value
    public static class MethodStats {
        PaymentMethod method;
        int attempts;
        int successes;
        int failures;
        long averageLatencyMs;
        Map<String, Integer> failuresByReason;
    }
}
