package com.permit.payment.api;

/** Webhook payload whose signature does not verify. Handler returns HTTP 400. */
public class WebhookSignatureException extends RuntimeException {

    public WebhookSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
