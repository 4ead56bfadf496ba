package com.permit.payment.api;

import com.permit.payment.core.PaymentGatewayClient;
import com.permit.payment.core.PaymentVelocityService;
import com.permit.payment.domain.IntentStatus;
import com.permit.payment.domain.OperationClass;
import com.permit.payment.domain.PaymentIntentRequest;
import com.permit.payment.domain.PaymentIntentResult;
import com.permit.payment.domain.PaymentMethod;
import com.permit.payment.domain.ProviderCustomer;
import com.permit.payment.domain.VelocityViolation;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for PaymentController using MockMvc.
 */
@WebMvcTest(controllers = PaymentController.class)
class PaymentControllerTest {

    private static final String CARD_REQUEST = """
            {
              "applicationId": "app-42",
              "customerId": "cus_1",
              "userId": "user-7",
              "email": "ana@example.com",
              "amount": 150.00,
              "paymentMethodId": "pm_card_visa"
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private PaymentGatewayClient gatewayClient;

    @MockitoBean
    private PaymentVelocityService velocityService;

    @Test
    void createCardIntentReturnsResultFromGatewayClient() throws Exception {
        PaymentIntentResult result = PaymentIntentResult.builder()
                .success(true)
                .applicationId("app-42")
                .paymentIntentId("pi_123")
                .idempotencyKey("pi_card_app-42_cus_1")
                .status(IntentStatus.REQUIRES_CONFIRMATION)
                .method(PaymentMethod.CARD)
                .amount(new BigDecimal("150.00"))
                .currency("MXN")
                .clientSecret("pi_123_secret")
                .created(Instant.parse("2026-03-01T10:00:00Z"))
                .build();
        when(gatewayClient.createPaymentIntentForCard(any())).thenReturn(result);

        mockMvc.perform(post("/api/v1/payments/intents/card")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1")
                        .content(CARD_REQUEST))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.paymentIntentId").value("pi_123"))
                .andExpect(jsonPath("$.status").value("REQUIRES_CONFIRMATION"))
                .andExpect(jsonPath("$.clientSecret").value("pi_123_secret"));

        ArgumentCaptor<PaymentIntentRequest> request = ArgumentCaptor.forClass(PaymentIntentRequest.class);
        verify(gatewayClient).createPaymentIntentForCard(request.capture());
        assertThat(request.getValue().getApplicationId()).isEqualTo("app-42");
        assertThat(request.getValue().getCurrency()).isEqualTo("MXN");
        assertThat(request.getValue().getClientIp()).isEqualTo("203.0.113.9");
    }

    @Test
    void createCardIntentWithMissingFieldsReturnsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/payments/intents/card")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "customerId": "cus_1",
                                  "amount": 0
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.applicationId").exists());

        verify(gatewayClient, never()).createPaymentIntentForCard(any());
    }

    @Test
    void openIntentForApplicationReturnsConflict() throws Exception {
        when(gatewayClient.createPaymentIntentForCard(any()))
                .thenThrow(new PaymentConflictException("A payment is already in progress", "pi_open"));

        mockMvc.perform(post("/api/v1/payments/intents/card")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_REQUEST))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("PAYMENT_IN_PROGRESS"))
                .andExpect(jsonPath("$.paymentIntentId").value("pi_open"));
    }

    @Test
    void rateLimitedRequestReturns429WithRetryAfter() throws Exception {
        when(gatewayClient.createPaymentIntentForCard(any()))
                .thenThrow(new RateLimitExceededException("Too many payment attempts", Duration.ofSeconds(90)));

        mockMvc.perform(post("/api/v1/payments/intents/card")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_REQUEST))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "90"))
                .andExpect(jsonPath("$.error").value("RATE_LIMIT_EXCEEDED"));
    }

    @Test
    void velocityRejectionHidesRiskDetails() throws Exception {
        when(gatewayClient.createPaymentIntentForCard(any())).thenThrow(new SecurityRejectionException(75,
                List.of(new VelocityViolation("user_hourly_limit", VelocityViolation.Severity.HIGH, 6, 5))));

        mockMvc.perform(post("/api/v1/payments/intents/card")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_REQUEST))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("PAYMENT_REJECTED"))
                .andExpect(jsonPath("$.message").value(SecurityRejectionException.USER_MESSAGE))
                .andExpect(jsonPath("$.riskScore").doesNotExist());
    }

    @Test
    void providerUnavailableReturns503() throws Exception {
        when(gatewayClient.processOxxoPayment(any()))
                .thenThrow(new ProviderUnavailableException(OperationClass.CASH_VOUCHER_PAYMENT, "Payment provider unavailable"));

        mockMvc.perform(post("/api/v1/payments/intents/oxxo")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CARD_REQUEST))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("PROVIDER_UNAVAILABLE"));
    }

    @Test
    void createCustomerReturnsProviderCustomer() throws Exception {
        when(gatewayClient.createCustomer("Ana", "ana@example.com", null))
                .thenReturn(ProviderCustomer.builder().id("cus_9").name("Ana").email("ana@example.com").build());

        mockMvc.perform(post("/api/v1/payments/customers")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                { "name": "Ana", "email": "ana@example.com" }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.id").value("cus_9"));
    }

    @Test
    void resetUserVelocityReturnsNoContent() throws Exception {
        mockMvc.perform(delete("/api/v1/payments/velocity/users/user-7"))
                .andExpect(status().isNoContent());

        verify(velocityService).resetUserVelocity("user-7");
    }
}
