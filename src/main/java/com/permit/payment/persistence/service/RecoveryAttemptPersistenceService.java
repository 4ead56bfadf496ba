package com.permit.payment.persistence.service;

import com.permit.payment.domain.RecoveryStatus;
import com.permit.payment.persistence.entity.RecoveryAttemptEntity;
import com.permit.payment.persistence.repository.RecoveryAttemptRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recovery attempt bookkeeping. Counters only grow; rows are never deleted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecoveryAttemptPersistenceService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final RecoveryAttemptRepository repository;

    public Optional<RecoveryAttemptEntity> find(String applicationId, String paymentIntentId) {
        return repository.findByApplicationIdAndPaymentIntentId(applicationId, paymentIntentId);
    }

    /**
     * Increments the attempt counter (creating the row on first use) and marks the
     * pair as RECOVERING. Optimistic locking rejects a concurrent increment.
     */
    @Transactional
    public RecoveryAttemptEntity recordAttempt(String applicationId, String paymentIntentId, Instant now) {
        RecoveryAttemptEntity entity = find(applicationId, paymentIntentId)
                .orElseGet(() -> RecoveryAttemptEntity.builder()
                        .applicationId(applicationId)
                        .paymentIntentId(paymentIntentId)
                        .attemptCount(0)
                        .build());
        entity.setAttemptCount(entity.getAttemptCount() + 1);
        entity.setLastAttemptTime(now);
        entity.setRecoveryStatus(RecoveryStatus.RECOVERING);
        return repository.saveAndFlush(entity);
    }

    @Transactional
    public void updateOutcome(String applicationId, String paymentIntentId, RecoveryStatus status, String lastError) {
        find(applicationId, paymentIntentId).ifPresentOrElse(entity -> {
            entity.setRecoveryStatus(status);
            entity.setLastError(truncate(lastError));
            repository.save(entity);
        }, () -> log.warn("No recovery attempt row for applicationId={}, paymentIntentId={} while setting {}",
                applicationId, paymentIntentId, status));
    }

    public List<RecoveryAttemptEntity> findStuckRecovering(Instant lastAttemptBefore, int limit) {
        return repository.findByRecoveryStatusAndLastAttemptTimeBeforeOrderByLastAttemptTimeAsc(
                RecoveryStatus.RECOVERING, lastAttemptBefore, PageRequest.of(0, limit));
    }

    public Map<RecoveryStatus, Long> countByStatusSince(Instant since) {
        Map<RecoveryStatus, Long> counts = new EnumMap<>(RecoveryStatus.class);
        for (Object[] row : repository.countByStatusSince(since)) {
            counts.put((RecoveryStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
