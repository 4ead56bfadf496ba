package com.permit.payment.persistence.service;

import com.permit.payment.domain.WebhookEvent;
import com.permit.payment.domain.WebhookProcessingStatus;
import com.permit.payment.persistence.entity.WebhookEventEntity;
import com.permit.payment.persistence.repository.WebhookEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

/**
 * Persists webhook deliveries and their processing status.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookEventPersistenceService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final WebhookEventRepository repository;

    public Optional<WebhookEventEntity> find(String eventId) {
        return repository.findById(eventId);
    }

    /**
     * Records the first delivery of an event as PENDING. A redelivery returns the
     * stored row untouched, so callers can tell a duplicate from a new event.
     */
    @Transactional
    public WebhookEventEntity recordReceived(WebhookEvent event) {
        Optional<WebhookEventEntity> existing = repository.findById(event.getEventId());
        if (existing.isPresent()) {
            return existing.get();
        }
        WebhookEventEntity entity = WebhookEventEntity.builder()
                .eventId(event.getEventId())
                .eventType(event.getType())
                .payload(event.getPayload())
                .paymentIntentId(event.getPaymentIntentId())
                .applicationId(event.getApplicationId())
                .processingStatus(WebhookProcessingStatus.PENDING)
                .retryCount(0)
                .build();
        try {
            return repository.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent delivery of webhook event {} detected; using stored row", event.getEventId());
            return repository.findById(event.getEventId()).orElseThrow(() -> e);
        }
    }

    @Transactional
    public void markProcessed(String eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.setProcessingStatus(WebhookProcessingStatus.PROCESSED);
            entity.setProcessedAt(Instant.now());
            entity.setLastError(null);
            repository.save(entity);
        });
    }

    @Transactional
    public void markFailed(String eventId, String error, int retryCount) {
        updateStatus(eventId, WebhookProcessingStatus.FAILED, error, retryCount);
    }

    /**
     * Sets FAILED_PERMANENT. Returns false when the event was already in a final status,
     * so callers can avoid raising a second alert.
     */
    @Transactional
    public boolean markFailedPermanent(String eventId, String reason) {
        Optional<WebhookEventEntity> existing = repository.findById(eventId);
        if (existing.isPresent() && existing.get().getProcessingStatus().isFinal()) {
            log.info("Webhook event {} already {}; not marking as failed permanently",
                    eventId, existing.get().getProcessingStatus());
            return false;
        }
        updateStatus(eventId, WebhookProcessingStatus.FAILED_PERMANENT, reason, null);
        return true;
    }

    private void updateStatus(String eventId, WebhookProcessingStatus status, String error, Integer retryCount) {
        Optional<WebhookEventEntity> existing = repository.findById(eventId);
        if (existing.isEmpty()) {
            log.warn("Webhook event {} not found while setting status {}", eventId, status);
            return;
        }
        WebhookEventEntity entity = existing.get();
        if (entity.getProcessingStatus() == WebhookProcessingStatus.PROCESSED) {
            log.info("Webhook event {} already processed; ignoring status {}", eventId, status);
            return;
        }
        entity.setProcessingStatus(status);
        entity.setLastError(truncate(error));
        if (retryCount != null) {
            entity.setRetryCount(retryCount);
        }
        repository.save(entity);
        log.debug("Webhook event {} status={} retryCount={}", eventId, status, entity.getRetryCount());
    }

    public long countByStatus(WebhookProcessingStatus status) {
        return repository.countByProcessingStatus(status);
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
