package com.permit.payment.messaging;

import com.permit.payment.domain.IntentStatus;
import com.permit.payment.domain.PaymentMethod;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Event emitted to Kafka when a payment reaches a terminal status. Downstream
 * consumers (permit submission, document generation, notifications) start their
 * work from PAYMENT_CONFIRMED.
 */
@Value
@Builder
@Jacksonized
public class PaymentEvent {

    public static final String PAYMENT_CONFIRMED = "PAYMENT_CONFIRMED";
    public static final String PAYMENT_FAILED = "PAYMENT_FAILED";

    String eventId;
    String applicationId;
    String paymentIntentId;
    PaymentMethod method;
    IntentStatus status;
    BigDecimal amount;
    String currency;
    /** What observed the status: webhook, recovery, reconciliation. */
    String source;
    Instant timestamp;
    /** Event type: PAYMENT_CONFIRMED, PAYMENT_FAILED */
    String eventType;
}
