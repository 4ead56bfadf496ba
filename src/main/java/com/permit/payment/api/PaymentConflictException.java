package com.permit.payment.api;

/**
 * Another payment intent for the same application is still open under a different
 * idempotency key. Handler returns HTTP 409.
 */
public class PaymentConflictException extends RuntimeException {

    private final String existingPaymentIntentId;

    public PaymentConflictException(String message, String existingPaymentIntentId) {
        super(message);
        this.existingPaymentIntentId = existingPaymentIntentId;
    }

    public String getExistingPaymentIntentId() {
        return existingPaymentIntentId;
    }
}
