package com.permit.payment.persistence.repository;

import com.permit.payment.domain.RecoveryStatus;
import com.permit.payment.persistence.entity.RecoveryAttemptEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface RecoveryAttemptRepository extends JpaRepository<RecoveryAttemptEntity, Long> {

    Optional<RecoveryAttemptEntity> findByApplicationIdAndPaymentIntentId(String applicationId, String paymentIntentId);

    List<RecoveryAttemptEntity> findByRecoveryStatusAndLastAttemptTimeBeforeOrderByLastAttemptTimeAsc(
            RecoveryStatus recoveryStatus, Instant lastAttemptBefore, Pageable pageable);

    @Query("SELECT r.recoveryStatus, COUNT(r) FROM RecoveryAttemptEntity r "
            + "WHERE r.lastAttemptTime >= :since GROUP BY r.recoveryStatus")
    List<Object[]> countByStatusSince(@Param("since") Instant since);
}
