package com.permit.payment.persistence.entity;

import com.permit.payment.domain.IntentStatus;
import com.permit.payment.domain.PaymentMethod;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Local record of a payment intent (the application's payment order). Keyed by the
 * deterministic idempotency key, so two concurrent creators of the same intent
 * collide on insert instead of producing two records.
 */
@Entity
@Table(name = "payment_intents", indexes = {
    @Index(name = "idx_payment_intent_provider_id", columnList = "payment_intent_id", unique = true),
    @Index(name = "idx_payment_intent_application", columnList = "application_id"),
    @Index(name = "idx_payment_intent_status_updated", columnList = "status, updated_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentIntentEntity {

    @Id
    @Column(name = "idempotency_key", nullable = false)
    private String idempotencyKey;

    @Column(name = "payment_intent_id", nullable = false)
    private String paymentIntentId;

    @Column(name = "application_id", nullable = false)
    private String applicationId;

    @Column(name = "customer_id")
    private String customerId;

    @Column(name = "amount", nullable = false, precision = 19, scale = 2)
    private BigDecimal amount;

    @Column(name = "currency", nullable = false, length = 3)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "method", nullable = false)
    private PaymentMethod method;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private IntentStatus status;

    @Column(name = "failure_code")
    private String failureCode;

    @Column(name = "failure_message", length = 1000)
    private String failureMessage;

    @Column(name = "voucher_reference")
    private String voucherReference;

    @Column(name = "voucher_url", length = 1000)
    private String voucherUrl;

    @Column(name = "voucher_expires_at")
    private Instant voucherExpiresAt;

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
