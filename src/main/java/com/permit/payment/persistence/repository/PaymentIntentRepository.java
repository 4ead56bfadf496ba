package com.permit.payment.persistence.repository;

import com.permit.payment.domain.IntentStatus;
import com.permit.payment.persistence.entity.PaymentIntentEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentIntentRepository extends JpaRepository<PaymentIntentEntity, String> {

    Optional<PaymentIntentEntity> findByPaymentIntentId(String paymentIntentId);

    Optional<PaymentIntentEntity> findFirstByApplicationIdOrderByCreatedAtDesc(String applicationId);

    List<PaymentIntentEntity> findByApplicationIdAndStatusIn(String applicationId, Collection<IntentStatus> statuses);

    long countByApplicationIdAndStatusIn(String applicationId, Collection<IntentStatus> statuses);

    List<PaymentIntentEntity> findByStatusInAndUpdatedAtBeforeOrderByUpdatedAtAsc(
            Collection<IntentStatus> statuses, Instant updatedBefore, Pageable pageable);
}
