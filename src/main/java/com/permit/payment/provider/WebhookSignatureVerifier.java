package com.permit.payment.provider;

import com.permit.payment.api.WebhookSignatureException;
import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.extern.slf4j.Slf4j;

/**
 * Verifies the {@code Stripe-Signature} header of a webhook delivery. A missing
 * signing secret fails closed in every environment.
 */
@Slf4j
public class WebhookSignatureVerifier {

    private final String secret;
    private final long toleranceSeconds;

    public WebhookSignatureVerifier(String secret, long toleranceSeconds) {
        this.secret = secret;
        this.toleranceSeconds = toleranceSeconds;
        if (!isConfigured()) {
            log.error("Webhook signing secret is not configured; every webhook delivery will be rejected");
        }
    }

    public boolean isConfigured() {
        return secret != null && !secret.isBlank();
    }

    public void verify(String payload, String signatureHeader) {
        if (!isConfigured()) {
            throw new IllegalStateException("Webhook signing secret is not configured");
        }
        if (signatureHeader == null || signatureHeader.isBlank()) {
            throw new WebhookSignatureException("Missing webhook signature header", null);
        }
        try {
            Webhook.Signature.verifyHeader(payload, signatureHeader, secret, toleranceSeconds);
        } catch (SignatureVerificationException e) {
            log.warn("Webhook signature verification failed: {}", e.getMessage());
            throw new WebhookSignatureException("Invalid webhook signature", e);
        }
    }
}
