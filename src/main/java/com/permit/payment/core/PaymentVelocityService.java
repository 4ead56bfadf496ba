package com.permit.payment.core;

import com.permit.payment.compliance.SensitiveDataMasker;
import com.permit.payment.domain.AlertSeverity;
import com.permit.payment.domain.VelocityCheckRequest;
import com.permit.payment.domain.VelocityVerdict;
import com.permit.payment.domain.VelocityViolation;
import com.permit.payment.domain.VelocityViolation.Severity;
import com.permit.payment.messaging.AlertProducer;
import com.permit.payment.messaging.OperationalAlert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Behavioral velocity screening before every charge. Counters live in Redis so the
 * limits hold across instances. Every attempt increments the counters; any
 * violation denies the attempt. Redis errors fail open.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentVelocityService {

    private static final String KEY_PREFIX = "velocity:";
    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofDays(1);

    private final StringRedisTemplate redisTemplate;
    private final AlertProducer alertProducer;

    @Value("${payment.velocity.user.hourly:5}")
    private long userHourlyLimit = 5;
    @Value("${payment.velocity.user.daily:10}")
    private long userDailyLimit = 10;
    @Value("${payment.velocity.ip.hourly:20}")
    private long ipHourlyLimit = 20;
    @Value("${payment.velocity.ip.daily:50}")
    private long ipDailyLimit = 50;
    @Value("${payment.velocity.card.hourly:3}")
    private long cardHourlyLimit = 3;
    @Value("${payment.velocity.card.daily:5}")
    private long cardDailyLimit = 5;
    @Value("${payment.velocity.email.hourly:5}")
    private long emailHourlyLimit = 5;
    @Value("${payment.velocity.email.daily:10}")
    private long emailDailyLimit = 10;
    @Value("${payment.velocity.high-value.threshold:5000}")
    private BigDecimal highValueThreshold = BigDecimal.valueOf(5000);
    @Value("${payment.velocity.high-value.hourly:2}")
    private long highValueHourlyLimit = 2;
    @Value("${payment.velocity.rapid-fire.max-attempts:3}")
    private long rapidFireLimit = 3;
    @Value("${payment.velocity.rapid-fire.window:60s}")
    private Duration rapidFireWindow = Duration.ofSeconds(60);
    @Value("${payment.velocity.distinct-cards.hourly:5}")
    private long distinctCardsLimit = 5;

    public VelocityVerdict check(VelocityCheckRequest request) {
        try {
            List<VelocityViolation> violations = new ArrayList<>();
            if (notBlank(request.getUserId())) {
                String user = "user:" + request.getUserId();
                limit(violations, "user_hourly_limit", incr(user + ":hourly", HOUR), userHourlyLimit, Severity.MEDIUM);
                limit(violations, "user_daily_limit", incr(user + ":daily", DAY), userDailyLimit, Severity.HIGH);
                limit(violations, "rapid_fire_attempts", incr(user + ":rapid", rapidFireWindow), rapidFireLimit, Severity.HIGH);
                if (request.getAmount() != null && request.getAmount().compareTo(highValueThreshold) >= 0) {
                    limit(violations, "high_value_hourly_limit", incr(user + ":high_value", HOUR),
                            highValueHourlyLimit, Severity.HIGH);
                }
                if (notBlank(request.getCardFingerprint())) {
                    limit(violations, "multiple_cards", distinctCards(user + ":cards", request.getCardFingerprint()),
                            distinctCardsLimit, Severity.HIGH);
                }
            }
            if (notBlank(request.getIpAddress())) {
                String ip = "ip:" + request.getIpAddress();
                limit(violations, "ip_hourly_limit", incr(ip + ":hourly", HOUR), ipHourlyLimit, Severity.MEDIUM);
                limit(violations, "ip_daily_limit", incr(ip + ":daily", DAY), ipDailyLimit, Severity.HIGH);
            }
            if (notBlank(request.getCardFingerprint())) {
                String card = "card:" + request.getCardFingerprint();
                limit(violations, "card_hourly_limit", incr(card + ":hourly", HOUR), cardHourlyLimit, Severity.HIGH);
                limit(violations, "card_daily_limit", incr(card + ":daily", DAY), cardDailyLimit, Severity.HIGH);
            }
            if (notBlank(request.getEmail())) {
                String email = "email:" + request.getEmail().trim().toLowerCase(Locale.ROOT);
                limit(violations, "email_hourly_limit", incr(email + ":hourly", HOUR), emailHourlyLimit, Severity.MEDIUM);
                limit(violations, "email_daily_limit", incr(email + ":daily", DAY), emailDailyLimit, Severity.HIGH);
            }

            VelocityVerdict verdict = VelocityVerdict.of(violations);
            if (!verdict.isAllowed()) {
                log.warn("Velocity check failed: userId={}, card={}, riskScore={}, rules={}", request.getUserId(),
                        SensitiveDataMasker.maskFingerprint(request.getCardFingerprint()),
                        verdict.getRiskScore(), ruleNames(verdict));
                if (verdict.hasHighSeverity()) {
                    sendFraudAlert(request, verdict);
                }
            }
            return verdict;
        } catch (Exception e) {
            log.error("Velocity check failed for userId={}; allowing the attempt", request.getUserId(), e);
            return VelocityVerdict.allow();
        }
    }

    /** Clears the per-user counters, e.g. after support verified a legitimate customer. */
    public void resetUserVelocity(String userId) {
        String user = KEY_PREFIX + "user:" + userId;
        Long deleted = redisTemplate.delete(List.of(user + ":hourly", user + ":daily", user + ":rapid",
                user + ":high_value", user + ":cards"));
        log.info("Reset velocity counters for userId={}, keysDeleted={}", userId, deleted);
    }

    private long incr(String key, Duration ttl) {
        String fullKey = KEY_PREFIX + key;
        Long count = redisTemplate.opsForValue().increment(fullKey);
        if (count != null && count == 1L) {
            redisTemplate.expire(fullKey, ttl);
        }
        return count != null ? count : 0L;
    }

    private long distinctCards(String key, String fingerprint) {
        String fullKey = KEY_PREFIX + key;
        Long added = redisTemplate.opsForSet().add(fullKey, fingerprint);
        if (added != null && added > 0) {
            redisTemplate.expire(fullKey, HOUR);
        }
        Long size = redisTemplate.opsForSet().size(fullKey);
        return size != null ? size : 0L;
    }

    private static void limit(List<VelocityViolation> violations, String rule, long count, long limit, Severity severity) {
        if (count > limit) {
            violations.add(new VelocityViolation(rule, severity, count, limit));
        }
    }

    private void sendFraudAlert(VelocityCheckRequest request, VelocityVerdict verdict) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("userId", request.getUserId());
        details.put("riskScore", verdict.getRiskScore());
        details.put("violations", ruleNames(verdict));
        details.put("amount", request.getAmount());
        alertProducer.send(OperationalAlert.of(
                "High-risk payment velocity detected",
                "Payment attempt blocked for user " + request.getUserId() + " with risk score " + verdict.getRiskScore(),
                AlertSeverity.CRITICAL,
                details));
    }

    private static List<String> ruleNames(VelocityVerdict verdict) {
        return verdict.getViolations().stream().map(VelocityViolation::getRule).collect(Collectors.toList());
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
