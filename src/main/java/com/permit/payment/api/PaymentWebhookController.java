package com.permit.payment.api;

import com.permit.payment.core.PaymentGatewayClient;
import com.permit.payment.domain.WebhookEvent;
import com.permit.payment.webhook.WebhookEventService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives provider webhooks. The body is taken as raw bytes because the signature
 * covers the exact payload.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/payments")
@RequiredArgsConstructor
@Tag(name = "Webhooks", description = "Signed provider notifications")
public class PaymentWebhookController {

    static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final PaymentGatewayClient gatewayClient;
    private final WebhookEventService webhookEventService;

    @PostMapping(value = "/webhook", consumes = MediaType.ALL_VALUE)
    @Operation(summary = "Provider webhook",
            description = "Verifies the signature and applies the event once per event id. Processing failures are "
                    + "retried internally, so any verified event is acknowledged with 200.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event accepted. Body: { \"received\": true, \"outcome\": ... }"),
            @ApiResponse(responseCode = "400", description = "Missing or invalid signature, or malformed payload."),
            @ApiResponse(responseCode = "500", description = "Webhook secret not configured; verification fails closed.")
    })
    public ResponseEntity<Map<String, Object>> receive(@RequestBody byte[] payload,
                                                       @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature) {
        WebhookEvent event = gatewayClient.constructWebhookEvent(payload, signature);
        log.info("Webhook received: eventId={}, type={}, paymentIntentId={}",
                event.getEventId(), event.getType(), event.getPaymentIntentId());
        WebhookEventService.Outcome outcome = webhookEventService.handle(event);
        return ResponseEntity.ok(Map.of("received", true, "eventId", event.getEventId(), "outcome", outcome.name()));
    }
}
