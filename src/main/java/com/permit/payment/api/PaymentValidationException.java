package com.permit.payment.api;

/**
 * Missing or malformed input, rejected before any external call. Handler returns HTTP 400.
 */
public class PaymentValidationException extends RuntimeException {

    public PaymentValidationException(String message) {
        super(message);
    }
}
