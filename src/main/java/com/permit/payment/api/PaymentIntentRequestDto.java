package com.permit.payment.api;

import com.permit.payment.domain.PaymentIntentRequest;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.util.Map;

/**
 * REST API request body for creating a card or OXXO payment intent for a permit application.
 */
@Data
public class PaymentIntentRequestDto {

    @NotBlank(message = "applicationId is required")
    private String applicationId;

    /** Provider customer id, e.g. from POST /api/v1/payments/customers. */
    @NotBlank(message = "customerId is required")
    private String customerId;

    private String customerName;
    private String userId;

    @Email
    private String email;

    @NotNull
    @DecimalMin("0.01")
    private BigDecimal amount;

    @NotBlank
    @Size(min = 3, max = 3)
    private String currency = "MXN";

    private String description;
    /** Card payment method (pm_...); not used for OXXO. */
    private String paymentMethodId;
    private String cardFingerprint;
    private String clientIp;
    private Map<String, String> metadata;

    public PaymentIntentRequest toRequest(String resolvedClientIp) {
        return PaymentIntentRequest.builder()
                .applicationId(applicationId)
                .customerId(customerId)
                .customerName(customerName)
                .userId(userId)
                .email(email)
                .clientIp(resolvedClientIp)
                .amount(amount)
                .currency(currency)
                .description(description)
                .paymentMethodId(paymentMethodId)
                .cardFingerprint(cardFingerprint)
                .metadata(metadata)
                .build();
    }
}
