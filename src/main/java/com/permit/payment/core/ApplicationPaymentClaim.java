package com.permit.payment.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Per-application claim held in Redis while a payment intent is being created.
 * <p>
 * The claim covers the window between the open-intent check and the insert of the
 * local record, which the database alone cannot guard because card and OXXO
 * requests use different idempotency keys. A request holding the same idempotency
 * key may re-enter; any other key is refused until the holder releases the claim or
 * its TTL expires. Redis errors fail open and leave the database check in charge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationPaymentClaim {

    static final String KEY_PREFIX = "payment:open:";

    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "if redis.call('get', KEYS[1]) == ARGV[1] then return redis.call('del', KEYS[1]) else return 0 end",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    @Value("${payment.idempotency.open-claim-ttl:2m}")
    private Duration claimTtl = Duration.ofMinutes(2);

    /**
     * Claims the application for the given idempotency key.
     *
     * @return false when another idempotency key holds the claim
     */
    public boolean tryClaim(String applicationId, String idempotencyKey) {
        String key = KEY_PREFIX + applicationId;
        try {
            if (Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, idempotencyKey, claimTtl))) {
                return true;
            }
            String holder = redisTemplate.opsForValue().get(key);
            if (holder == null) {
                // expired between the two calls
                return Boolean.TRUE.equals(redisTemplate.opsForValue().setIfAbsent(key, idempotencyKey, claimTtl));
            }
            if (holder.equals(idempotencyKey)) {
                return true;
            }
            log.warn("Application {} is being charged under idempotencyKey={}; refusing {}",
                    applicationId, holder, idempotencyKey);
            return false;
        } catch (Exception e) {
            log.error("Payment claim unavailable for applicationId={}; relying on the stored open-intent check",
                    applicationId, e);
            return true;
        }
    }

    /** Releases the claim if the given idempotency key still holds it. */
    public void release(String applicationId, String idempotencyKey) {
        try {
            redisTemplate.execute(RELEASE_SCRIPT, List.of(KEY_PREFIX + applicationId), idempotencyKey);
        } catch (Exception e) {
            log.warn("Could not release payment claim for applicationId={}; it expires after {}",
                    applicationId, claimTtl, e);
        }
    }
}
