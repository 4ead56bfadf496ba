package com.permit.payment.core;

import com.permit.payment.domain.CashVoucherDetails;
import com.permit.payment.domain.PaymentIntentResult;
import com.permit.payment.domain.RecoveryResult;
import com.permit.payment.persistence.entity.PaymentIntentEntity;
import com.permit.payment.persistence.service.PaymentIntentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL cache that dedupes retried or concurrent operations across instances.
 * <ul>
 *   <li>Payment intent results under their idempotency key, with the payment_intents
 *       table as persistent fallback.</li>
 *   <li>Recovery results under {@code recovery_{applicationId}_{paymentIntentId}}.</li>
 * </ul>
 * Redis failures are treated as cache misses (fail-open); the database and the
 * provider's own idempotency keys still prevent double charges.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdempotencyService {

    private static final String INTENT_KEY_PREFIX = "payment:idempotency:";
    private static final String RECOVERY_KEY_PREFIX = "payment:";

    private final RedisTemplate<String, PaymentIntentResult> intentResultTemplate;
    private final RedisTemplate<String, RecoveryResult> recoveryResultTemplate;
    private final PaymentIntentPersistenceService intentPersistence;

    @Value("${payment.idempotency.intent-ttl:24h}")
    private Duration intentTtl = Duration.ofHours(24);

    @Value("${payment.recovery.result-ttl:5m}")
    private Duration recoveryTtl = Duration.ofMinutes(5);

    public static String recoveryKey(String applicationId, String paymentIntentId) {
        return "recovery_" + applicationId + "_" + paymentIntentId;
    }

    /**
     * Previously produced result for this idempotency key. Checks Redis first,
     * then the persisted intent record.
     */
    public Optional<PaymentIntentResult> getCachedIntentResult(String idempotencyKey) {
        String key = INTENT_KEY_PREFIX + idempotencyKey;
        try {
            PaymentIntentResult cached = intentResultTemplate.opsForValue().get(key);
            if (cached != null) {
                log.debug("Idempotency hit in Redis for key={}", idempotencyKey);
                return Optional.of(cached);
            }
        } catch (Exception e) {
            log.warn("Idempotency cache read failed for key={}, falling back to database: {}",
                    idempotencyKey, e.getMessage());
        }

        try {
            Optional<PaymentIntentEntity> entity = intentPersistence.findByIdempotencyKey(idempotencyKey);
            if (entity.isPresent()) {
                PaymentIntentResult result = toResult(entity.get());
                log.debug("Idempotency hit in database for key={}, status={}", idempotencyKey, result.getStatus());
                storeIntentResult(idempotencyKey, result);
                return Optional.of(result);
            }
        } catch (Exception e) {
            log.error("Database idempotency check failed for key={}: {}", idempotencyKey, e.getMessage());
        }
        return Optional.empty();
    }

    public void storeIntentResult(String idempotencyKey, PaymentIntentResult result) {
        try {
            intentResultTemplate.opsForValue().set(INTENT_KEY_PREFIX + idempotencyKey, result, intentTtl);
            log.debug("Stored idempotency result for key={}", idempotencyKey);
        } catch (Exception e) {
            log.warn("Failed to cache payment intent result for key={}: {}", idempotencyKey, e.getMessage());
        }
    }

    public Optional<RecoveryResult> getCachedRecoveryResult(String applicationId, String paymentIntentId) {
        String key = RECOVERY_KEY_PREFIX + recoveryKey(applicationId, paymentIntentId);
        try {
            return Optional.ofNullable(recoveryResultTemplate.opsForValue().get(key));
        } catch (Exception e) {
            log.warn("Recovery cache read failed for key={}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void storeRecoveryResult(String applicationId, String paymentIntentId, RecoveryResult result) {
        String key = RECOVERY_KEY_PREFIX + recoveryKey(applicationId, paymentIntentId);
        try {
            recoveryResultTemplate.opsForValue().set(key, result, recoveryTtl);
        } catch (Exception e) {
            log.warn("Failed to cache recovery result for key={}: {}", key, e.getMessage());
        }
    }

    public void evictRecoveryResult(String applicationId, String paymentIntentId) {
        String key = RECOVERY_KEY_PREFIX + recoveryKey(applicationId, paymentIntentId);
        try {
            recoveryResultTemplate.delete(key);
        } catch (Exception e) {
            log.warn("Failed to evict recovery result for key={}: {}", key, e.getMessage());
        }
    }

    static PaymentIntentResult toResult(PaymentIntentEntity entity) {
        CashVoucherDetails voucher = entity.getVoucherReference() == null ? null : CashVoucherDetails.builder()
                .reference(entity.getVoucherReference())
                .hostedVoucherUrl(entity.getVoucherUrl())
                .expiresAt(entity.getVoucherExpiresAt())
                .build();
        return PaymentIntentResult.builder()
                .success(true)
                .applicationId(entity.getApplicationId())
                .paymentIntentId(entity.getPaymentIntentId())
                .idempotencyKey(entity.getIdempotencyKey())
                .status(entity.getStatus())
                .method(entity.getMethod())
                .amount(entity.getAmount())
                .currency(entity.getCurrency())
                .created(entity.getCreatedAt())
                .voucher(voucher)
                .failureMessage(entity.getFailureMessage())
                .errorCode(entity.getFailureCode())
                .build();
    }
}
