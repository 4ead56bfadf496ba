package com.permit.payment.persistence.repository;

import com.permit.payment.domain.WebhookProcessingStatus;
import com.permit.payment.persistence.entity.WebhookEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEventEntity, String> {

    long countByProcessingStatus(WebhookProcessingStatus processingStatus);
}
