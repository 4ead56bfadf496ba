package com.permit.payment.domain;

public enum WebhookProcessingStatus {
    PENDING,
    PROCESSED,
    FAILED,
    FAILED_PERMANENT;

    /** Events in a final status are never processed again. */
    public boolean isFinal() {
        return this == PROCESSED || this == FAILED_PERMANENT;
    }
}
