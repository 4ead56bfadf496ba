package com.permit.payment.api;

import com.permit.payment.domain.IntentStatus;

/**
 * Local and provider state disagree in a way that cannot be converged automatically,
 * e.g. a locally FAILED payment the provider reports as canceled.
 */
public class PaymentConsistencyException extends RuntimeException {

    private final String paymentIntentId;
    private final IntentStatus localStatus;
    private final IntentStatus providerStatus;

    public PaymentConsistencyException(String paymentIntentId, IntentStatus localStatus, IntentStatus providerStatus) {
        super("Payment " + paymentIntentId + " is " + localStatus + " locally but " + providerStatus + " at the provider");
        this.paymentIntentId = paymentIntentId;
        this.localStatus = localStatus;
        this.providerStatus = providerStatus;
    }

    public String getPaymentIntentId() {
        return paymentIntentId;
    }

    public IntentStatus getLocalStatus() {
        return localStatus;
    }

    public IntentStatus getProviderStatus() {
        return providerStatus;
    }
}
