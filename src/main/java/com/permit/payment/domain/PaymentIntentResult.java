package com.permit.payment.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Canonical result of a payment intent creation, returned to callers and cached
 * under the intent's idempotency key. A provider decline is a result with
 * {@code success=false}, not an exception.
 */
@Value
@Builder
@Jacksonized
public class PaymentIntentResult {

    boolean success;
    String applicationId;
    String paymentIntentId;
    String idempotencyKey;
    IntentStatus status;
    PaymentMethod method;
    BigDecimal amount;
    String currency;
    String clientSecret;
    Instant created;
    CashVoucherDetails voucher;

    /** Localized message safe to show to the customer. */
    String failureMessage;
    String errorCode;
    String errorType;

    public static PaymentIntentResult failure(PaymentIntentRequest request, PaymentMethod method,
                                              String idempotencyKey, String failureMessage,
                                              String errorCode, String errorType) {
        return PaymentIntentResult.builder()
                .success(false)
                .applicationId(request.getApplicationId())
                .idempotencyKey(idempotencyKey)
                .method(method)
                .amount(request.getAmount())
                .currency(request.getCurrency())
                .failureMessage(failureMessage)
                .errorCode(errorCode)
                .errorType(errorType)
                .created(Instant.now())
                .build();
    }
}
