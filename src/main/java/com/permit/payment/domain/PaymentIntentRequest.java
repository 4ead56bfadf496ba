package com.permit.payment.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Input for creating a card or cash-voucher payment intent for a permit application.
 * Amount is in major units (pesos); the provider client converts to minor units.
 */
@Value
@Builder
public class PaymentIntentRequest {

    String applicationId;
    String customerId;
    /** Customer name, printed on cash vouchers. */
    String customerName;
    String userId;
    String email;
    String clientIp;
    BigDecimal amount;
    String currency;
    String description;
    /** Card only: provider payment method id collected by the browser. */
    String paymentMethodId;
    /** Card only: provider card fingerprint, used by the velocity guard. */
    String cardFingerprint;
    Map<String, String> metadata;
}
