package com.permit.payment.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Provider payment intent mapped out of the provider SDK model.
 */
@Value
@Builder(toBuilder = true)
public class ProviderPaymentIntent {

    String id;
    IntentStatus status;
    String paymentMethod;
    BigDecimal amount;
    String currency;
    String clientSecret;
    Instant created;
    Map<String, String> metadata;
    /** Present for cash-voucher intents once the voucher has been issued. */
    CashVoucherDetails voucher;
    String lastPaymentError;
    String lastPaymentErrorCode;
}
