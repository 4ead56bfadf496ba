package com.permit.payment.persistence.service;

import com.permit.payment.domain.IntentStatus;
import com.permit.payment.domain.PaymentIntentResult;
import com.permit.payment.persistence.entity.PaymentIntentEntity;
import com.permit.payment.persistence.repository.PaymentIntentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads and writes local payment intent records.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentIntentPersistenceService {

    public static final Set<IntentStatus> OPEN_STATUSES = Arrays.stream(IntentStatus.values())
            .filter(s -> !s.isTerminal())
            .collect(Collectors.toCollection(() -> EnumSet.noneOf(IntentStatus.class)));

    public static final Set<IntentStatus> CLOSED_STATUSES = EnumSet.complementOf(EnumSet.copyOf(OPEN_STATUSES));

    private final PaymentIntentRepository repository;

    public Optional<PaymentIntentEntity> findByIdempotencyKey(String idempotencyKey) {
        return repository.findById(idempotencyKey);
    }

    public Optional<PaymentIntentEntity> findByPaymentIntentId(String paymentIntentId) {
        return repository.findByPaymentIntentId(paymentIntentId);
    }

    public Optional<PaymentIntentEntity> findLatestForApplication(String applicationId) {
        return repository.findFirstByApplicationIdOrderByCreatedAtDesc(applicationId);
    }

    /** The single non-terminal record of an application, if any. */
    public Optional<PaymentIntentEntity> findOpenIntent(String applicationId) {
        List<PaymentIntentEntity> open = repository.findByApplicationIdAndStatusIn(applicationId, OPEN_STATUSES);
        if (open.size() > 1) {
            log.error("Application {} has {} open payment intents: {}", applicationId, open.size(),
                    open.stream().map(PaymentIntentEntity::getPaymentIntentId).collect(Collectors.toList()));
        }
        return open.stream().findFirst();
    }

    public long countClosedIntents(String applicationId) {
        return repository.countByApplicationIdAndStatusIn(applicationId, CLOSED_STATUSES);
    }

    /**
     * Inserts the record for a newly created intent. If another request already
     * inserted the same idempotency key, the existing record is returned.
     */
    @Transactional
    public PaymentIntentEntity recordCreated(PaymentIntentResult result, String customerId) {
        PaymentIntentEntity entity = PaymentIntentEntity.builder()
                .idempotencyKey(result.getIdempotencyKey())
                .paymentIntentId(result.getPaymentIntentId())
                .applicationId(result.getApplicationId())
                .customerId(customerId)
                .amount(result.getAmount())
                .currency(result.getCurrency())
                .method(result.getMethod())
                .status(result.getStatus())
                .voucherReference(result.getVoucher() != null ? result.getVoucher().getReference() : null)
                .voucherUrl(result.getVoucher() != null ? result.getVoucher().getHostedVoucherUrl() : null)
                .voucherExpiresAt(result.getVoucher() != null ? result.getVoucher().getExpiresAt() : null)
                .build();
        try {
            PaymentIntentEntity saved = repository.saveAndFlush(entity);
            log.debug("Persisted payment intent: idempotencyKey={}, paymentIntentId={}, status={}",
                    saved.getIdempotencyKey(), saved.getPaymentIntentId(), saved.getStatus());
            return saved;
        } catch (DataIntegrityViolationException e) {
            log.warn("Payment intent already recorded for idempotencyKey={}; using existing record",
                    result.getIdempotencyKey());
            return repository.findById(result.getIdempotencyKey()).orElseThrow(() -> e);
        }
    }

    @Transactional
    public PaymentIntentEntity save(PaymentIntentEntity entity) {
        return repository.save(entity);
    }

    /**
     * Bumps {@code updatedAt} of a record the provider confirmed unchanged, so the
     * reconciliation sweep moves on to other stale records.
     */
    @Transactional
    public PaymentIntentEntity markChecked(PaymentIntentEntity entity) {
        entity.setUpdatedAt(Instant.now());
        return repository.save(entity);
    }

    /** Non-terminal records not touched since {@code updatedBefore}, oldest first. */
    public List<PaymentIntentEntity> findStuck(Instant updatedBefore, int limit) {
        return repository.findByStatusInAndUpdatedAtBeforeOrderByUpdatedAtAsc(
                OPEN_STATUSES, updatedBefore, PageRequest.of(0, limit));
    }
}
