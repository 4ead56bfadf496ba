package com.permit.payment.provider;

import com.permit.payment.domain.PaymentIntentRequest;
import com.permit.payment.domain.PaymentMethod;
import com.permit.payment.domain.ProviderCustomer;
import com.permit.payment.domain.ProviderPaymentIntent;

import java.util.Optional;

/**
 * Interface for the external payment provider.
 * Implementations translate provider SDK errors into {@link ProviderException} and
 * must bound every call with connect/read timeouts.
 */
public interface PaymentProviderClient {

    /** Name used in logs, e.g. "stripe". */
    String getName();

    Optional<ProviderCustomer> findCustomerByEmail(String email);

    ProviderCustomer createCustomer(String name, String email, String phone, String idempotencyKey);

    /**
     * Create a payment intent. The provider deduplicates on {@code idempotencyKey}, so
     * repeating the call with the same key returns the same intent.
     */
    ProviderPaymentIntent createPaymentIntent(PaymentIntentRequest request, PaymentMethod method, String idempotencyKey);

    /** Empty when the provider does not know the intent. */
    Optional<ProviderPaymentIntent> retrievePaymentIntent(String paymentIntentId);

    ProviderPaymentIntent confirmPaymentIntent(String paymentIntentId);

    ProviderPaymentIntent capturePaymentIntent(String paymentIntentId);
}
