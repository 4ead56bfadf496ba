package com.permit.payment.persistence.entity;

import com.permit.payment.domain.RecoveryStatus;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Recovery bookkeeping per (application, payment intent). Rows are never deleted;
 * they are the audit trail of recovery activity.
 */
@Entity
@Table(name = "payment_recovery_attempts",
        uniqueConstraints = @UniqueConstraint(name = "uk_recovery_application_intent",
                columnNames = {"application_id", "payment_intent_id"}),
        indexes = @Index(name = "idx_recovery_status_last_attempt", columnList = "recovery_status, last_attempt_time"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryAttemptEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "application_id", nullable = false)
    private String applicationId;

    @Column(name = "payment_intent_id", nullable = false)
    private String paymentIntentId;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "last_attempt_time")
    private Instant lastAttemptTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "recovery_status", nullable = false)
    private RecoveryStatus recoveryStatus;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
