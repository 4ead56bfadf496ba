package com.permit.payment.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** Read-only projection of the recovery bookkeeping for one (application, intent) pair. */
@Value
@Builder
public class RecoveryStatusView {

    String applicationId;
    String paymentIntentId;
    int attempts;
    int maxAttempts;
    boolean canRetry;
    RecoveryStatus status;
    Instant lastAttemptTime;
    String lastError;
    /** Delay the next attempt's re-check would use, in milliseconds. */
    long nextAttemptDelayMs;
}
