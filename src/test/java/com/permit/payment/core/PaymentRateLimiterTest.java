package com.permit.payment.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class PaymentRateLimiterTest {

    private MutableClock clock;
    private PaymentRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        rateLimiter = new PaymentRateLimiter(clock);
        ReflectionTestUtils.setField(rateLimiter, "maxAttempts", 3);
        ReflectionTestUtils.setField(rateLimiter, "window", Duration.ofMinutes(10));
    }

    @Test
    void allowsUpToLimitThenRejects() {
        assertThat(rateLimiter.tryAcquire("cus_1", "app_1")).isTrue();
        assertThat(rateLimiter.tryAcquire("cus_1", "app_1")).isTrue();
        assertThat(rateLimiter.tryAcquire("cus_1", "app_1")).isTrue();
        assertThat(rateLimiter.tryAcquire("cus_1", "app_1")).isFalse();
    }

    @Test
    void limitIsPerCustomerAndApplication() {
        for (int i = 0; i < 3; i++) {
            rateLimiter.tryAcquire("cus_1", "app_1");
        }

        assertThat(rateLimiter.tryAcquire("cus_1", "app_2")).isTrue();
        assertThat(rateLimiter.tryAcquire("cus_2", "app_1")).isTrue();
    }

    @Test
    void attemptsExpireWithWindow() {
        rateLimiter.tryAcquire("cus_1", "app_1");
        clock.advance(Duration.ofMinutes(4));
        rateLimiter.tryAcquire("cus_1", "app_1");
        rateLimiter.tryAcquire("cus_1", "app_1");

        assertThat(rateLimiter.retryAfter("cus_1", "app_1")).isEqualTo(Duration.ofMinutes(6));

        clock.advance(Duration.ofMinutes(6));
        assertThat(rateLimiter.tryAcquire("cus_1", "app_1")).isTrue();
        assertThat(rateLimiter.tryAcquire("cus_1", "app_1")).isFalse();
    }

    @Test
    void retryAfterIsZeroWithoutAttempts() {
        assertThat(rateLimiter.retryAfter("cus_9", "app_9")).isEqualTo(Duration.ZERO);
    }

    @Test
    void idleKeysAreEvictedOnceTheirWindowPasses() {
        rateLimiter.tryAcquire("cus_1", "app_1");
        rateLimiter.tryAcquire("cus_2", "app_2");
        clock.advance(Duration.ofMinutes(8));
        rateLimiter.tryAcquire("cus_3", "app_3");
        assertThat(rateLimiter.getTrackedKeyCount()).isEqualTo(3);

        clock.advance(Duration.ofMinutes(3));
        rateLimiter.evictExpired();

        assertThat(rateLimiter.getTrackedKeyCount()).isEqualTo(1);
        assertThat(rateLimiter.retryAfter("cus_1", "app_1")).isEqualTo(Duration.ZERO);
        assertThat(rateLimiter.retryAfter("cus_3", "app_3")).isEqualTo(Duration.ofMinutes(7));
    }

    @Test
    void manyDistinctCustomersDoNotAccumulate() {
        for (int i = 0; i < 1_000; i++) {
            rateLimiter.tryAcquire("cus_" + i, "app_" + i);
        }
        clock.advance(Duration.ofMinutes(11));
        rateLimiter.evictExpired();

        assertThat(rateLimiter.getTrackedKeyCount()).isZero();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
