package com.permit.payment.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Outcome of one recovery attempt. Recovery never throws; every outcome, including
 * errors, is one of these.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecoveryResult {

    public static final String PAYMENT_SUCCEEDED = "payment_succeeded";
    public static final String STILL_PROCESSING = "still_processing";
    public static final String PAYMENT_FAILED = "payment_failed";
    public static final String PAYMENT_CANCELED = "payment_canceled";
    public static final String REQUIRES_PAYMENT_METHOD = "requires_payment_method";
    public static final String CONFIRMATION_FAILED = "confirmation_failed";
    public static final String CONFIRMATION_ERROR = "confirmation_error";
    public static final String CAPTURE_FAILED = "capture_failed";
    public static final String APPLICATION_NOT_FOUND = "application_not_found";
    public static final String REQUIRES_ACTION = "requires_action";
    public static final String REQUIRES_MANUAL_CAPTURE = "requires_manual_capture";
    public static final String CAPTURE_ERROR = "capture_error";
    public static final String PAYMENT_INTENT_NOT_FOUND = "payment_intent_not_found";
    public static final String MAX_ATTEMPTS_REACHED = "max_attempts_reached";
    public static final String CIRCUIT_BREAKER_OPEN = "circuit_breaker_open";
    public static final String STATUS_CONFLICT = "status_conflict";
    public static final String RECOVERY_ERROR = "recovery_error";
    public static final String UNEXPECTED_STATUS = "unexpected_status";

    boolean success;
    String reason;
    String applicationId;
    String paymentIntentId;
    /** Provider status observed during the attempt, if the provider was reached. */
    IntentStatus status;
    /** Seconds until the scheduled re-check, for {@link #STILL_PROCESSING}. */
    Long nextCheckIn;
    /** What the customer has to do next, if anything. */
    String userAction;
    /** Message for the customer. */
    String message;
    String error;
    Instant timestamp;
}
