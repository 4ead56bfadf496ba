package com.permit.payment.api;

import com.permit.payment.core.PaymentGatewayClient;
import com.permit.payment.core.PaymentVelocityService;
import com.permit.payment.domain.PaymentIntentResult;
import com.permit.payment.domain.ProviderCustomer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for provider customers and permit payment intents.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Payments", description = "Create provider customers and card/OXXO payment intents")
public class PaymentController {

    private final PaymentGatewayClient gatewayClient;
    private final PaymentVelocityService velocityService;

    @PostMapping("/customers")
    @Operation(summary = "Find or create customer",
            description = "Returns the provider customer for the email, creating it if needed. Safe to retry.")
    public ResponseEntity<ProviderCustomer> createCustomer(@Valid @RequestBody CustomerRequestDto dto) {
        return ResponseEntity.ok(gatewayClient.createCustomer(dto.getName(), dto.getEmail(), dto.getPhone()));
    }

    @PostMapping("/intents/card")
    @Operation(
            summary = "Create card payment intent",
            description = "Creates the card payment intent for a permit application. The idempotency key is derived from "
                    + "applicationId and customerId, so repeating the request returns the same intent. "
                    + "On provider decline returns 200 with success=false and a localized failureMessage.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Intent created or returned. Check body.success.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentIntentResult.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed. Body: { \"error\": \"VALIDATION_FAILED\"|\"BAD_REQUEST\", ... }"),
            @ApiResponse(responseCode = "403", description = "Rejected by the velocity check. Body: { \"error\": \"PAYMENT_REJECTED\", \"message\": \"...\" }"),
            @ApiResponse(responseCode = "409", description = "Another payment is in progress for the application."),
            @ApiResponse(responseCode = "429", description = "Too many attempts for this customer and application; see Retry-After."),
            @ApiResponse(responseCode = "503", description = "Provider unavailable or circuit open. Retry later.")
    })
    public ResponseEntity<PaymentIntentResult> createCardIntent(@Valid @RequestBody PaymentIntentRequestDto dto,
                                                                HttpServletRequest httpRequest) {
        PaymentIntentResult result = gatewayClient.createPaymentIntentForCard(dto.toRequest(resolveClientIp(dto, httpRequest)));
        log.debug("Card intent request completed: applicationId={}, success={}, status={}",
                dto.getApplicationId(), result.isSuccess(), result.getStatus());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/intents/oxxo")
    @Operation(
            summary = "Create OXXO payment",
            description = "Creates and confirms an OXXO cash-voucher intent. The body carries the voucher reference, "
                    + "hosted voucher URL and expiry the customer needs to pay in store.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Voucher created or returned. Check body.success.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = PaymentIntentResult.class))),
            @ApiResponse(responseCode = "400", description = "Validation failed."),
            @ApiResponse(responseCode = "403", description = "Rejected by the velocity check."),
            @ApiResponse(responseCode = "409", description = "Another payment is in progress for the application."),
            @ApiResponse(responseCode = "429", description = "Too many attempts; see Retry-After."),
            @ApiResponse(responseCode = "503", description = "Provider unavailable or circuit open.")
    })
    public ResponseEntity<PaymentIntentResult> createOxxoPayment(@Valid @RequestBody PaymentIntentRequestDto dto,
                                                                 HttpServletRequest httpRequest) {
        return ResponseEntity.ok(gatewayClient.processOxxoPayment(dto.toRequest(resolveClientIp(dto, httpRequest))));
    }

    @DeleteMapping("/velocity/users/{userId}")
    @Operation(summary = "Reset user velocity counters",
            description = "Clears the velocity counters of a user, e.g. after support verified a legitimate customer.")
    public ResponseEntity<Void> resetUserVelocity(@PathVariable String userId) {
        velocityService.resetUserVelocity(userId);
        return ResponseEntity.noContent().build();
    }

    private static String resolveClientIp(PaymentIntentRequestDto dto, HttpServletRequest request) {
        if (dto.getClientIp() != null && !dto.getClientIp().isBlank()) {
            return dto.getClientIp();
        }
        if (request == null) {
            return null;
        }
        String xff = request.getHeader("X-Forwarded-For");
        if (xff != null && !xff.isBlank()) {
            return xff.split(",")[0].trim();
        }
        String xri = request.getHeader("X-Real-IP");
        if (xri != null && !xri.isBlank()) return xri.trim();
        return request.getRemoteAddr();
    }
}
