package com.permit.payment.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * A verified provider notification. Only the payment-intent fields this layer acts
 * on are extracted; the raw payload is kept for persistence and retries.
 */
@Value
@Builder
public class WebhookEvent {

    public static final String PAYMENT_INTENT_SUCCEEDED = "payment_intent.succeeded";
    public static final String PAYMENT_INTENT_FAILED = "payment_intent.payment_failed";
    public static final String PAYMENT_INTENT_CANCELED = "payment_intent.canceled";
    public static final String PAYMENT_INTENT_PROCESSING = "payment_intent.processing";
    public static final String PAYMENT_INTENT_REQUIRES_ACTION = "payment_intent.requires_action";

    String eventId;
    String type;
    Instant created;
    String paymentIntentId;
    String intentStatus;
    Map<String, String> metadata;
    String lastPaymentError;
    String lastPaymentErrorCode;
    String payload;

    public boolean isPaymentIntentEvent() {
        return type != null && type.startsWith("payment_intent.");
    }

    /** Application id the intent was created for, from the intent metadata. */
    public String getApplicationId() {
        return metadata != null ? metadata.get("application_id") : null;
    }
}
