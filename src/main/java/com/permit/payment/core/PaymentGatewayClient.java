package com.permit.payment.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.permit.payment.api.PaymentConflictException;
import com.permit.payment.api.PaymentValidationException;
import com.permit.payment.api.ProviderUnavailableException;
import com.permit.payment.api.RateLimitExceededException;
import com.permit.payment.api.SecurityRejectionException;
import com.permit.payment.compliance.PaymentAuditLogger;
import com.permit.payment.compliance.SensitiveDataMasker;
import com.permit.payment.domain.CashVoucherDetails;
import com.permit.payment.domain.OperationClass;
import com.permit.payment.domain.PaymentIntentRequest;
import com.permit.payment.domain.PaymentIntentResult;
import com.permit.payment.domain.PaymentMethod;
import com.permit.payment.domain.ProviderCustomer;
import com.permit.payment.domain.ProviderPaymentIntent;
import com.permit.payment.domain.VelocityCheckRequest;
import com.permit.payment.domain.VelocityVerdict;
import com.permit.payment.domain.WebhookEvent;
import com.permit.payment.persistence.entity.PaymentIntentEntity;
import com.permit.payment.persistence.service.PaymentIntentPersistenceService;
import com.permit.payment.provider.PaymentProviderClient;
import com.permit.payment.provider.ProviderException;
import com.permit.payment.provider.WebhookSignatureVerifier;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for every call to the payment provider.
 * <p>
 * Charge attempts are rate limited per (customer, application), screened by the
 * velocity guard and tagged with a deterministic idempotency key before the provider
 * is called through the circuit breaker of the payment method. A retried request
 * therefore never creates a second intent, and an application never has more than
 * one open intent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentGatewayClient {

    public static final String VELOCITY_CHECK_FAILED = "velocity_check_failed";
    private static final String PROVIDER_UNAVAILABLE = "provider_unavailable";
    private static final String RATE_LIMIT_MESSAGE =
            "Demasiados intentos de pago. Por favor, espere unos minutos e intente nuevamente.";
    private static final String PAYMENT_IN_PROGRESS_MESSAGE = "Ya existe un pago en curso para esta solicitud.";

    private final PaymentProviderClient provider;
    private final PaymentCircuitBreakers circuitBreakers;
    private final IdempotencyService idempotencyService;
    private final PaymentRateLimiter rateLimiter;
    private final PaymentVelocityService velocityService;
    private final PaymentMetrics metrics;
    private final PaymentIntentPersistenceService intentPersistence;
    private final ApplicationPaymentClaim paymentClaim;
    private final WebhookSignatureVerifier signatureVerifier;
    private final PaymentAuditLogger auditLogger;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${payment.velocity.enabled:true}")
    private boolean velocityEnabled = true;

    @Value("${payment.provider.cash-voucher-expiry-days:2}")
    private long cashVoucherExpiryDays = 2;

    @jakarta.annotation.PostConstruct
    void init() {
        log.info("PaymentGatewayClient configuration: provider={}, velocityEnabled={}, webhookSecretConfigured={}",
                provider.getName(), velocityEnabled, signatureVerifier.isConfigured());
    }

    /**
     * Finds the provider customer for this email or creates it. Creation uses an
     * idempotency key derived from the email; losing a creation race to another
     * request re-reads the customer instead of failing.
     */
    public ProviderCustomer createCustomer(String name, String email, String phone) {
        if (name == null || name.isBlank()) {
            throw new PaymentValidationException("Customer name is required");
        }
        if (email == null || email.isBlank() || !email.contains("@")) {
            throw new PaymentValidationException("A valid customer email is required");
        }
        String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
        return call(OperationClass.CUSTOMER_OPERATIONS, () -> {
            Optional<ProviderCustomer> existing = provider.findCustomerByEmail(normalizedEmail);
            if (existing.isPresent()) {
                log.debug("Found existing customer {} for email={}", existing.get().getId(),
                        SensitiveDataMasker.maskEmail(normalizedEmail));
                return existing.get();
            }
            try {
                return provider.createCustomer(name.trim(), normalizedEmail, phone, customerIdempotencyKey(normalizedEmail));
            } catch (ProviderException e) {
                if (!ProviderException.RESOURCE_ALREADY_EXISTS.equals(e.getCode())) {
                    throw e;
                }
                log.info("Customer for email={} was created concurrently; re-reading it",
                        SensitiveDataMasker.maskEmail(normalizedEmail));
                return provider.findCustomerByEmail(normalizedEmail).orElseThrow(() -> e);
            }
        });
    }

    public PaymentIntentResult createPaymentIntentForCard(PaymentIntentRequest request) {
        return createPaymentIntent(request, PaymentMethod.CARD);
    }

    /** Creates an OXXO intent; the result carries the voucher the customer pays in store. */
    public PaymentIntentResult processOxxoPayment(PaymentIntentRequest request) {
        return createPaymentIntent(request, PaymentMethod.CASH_VOUCHER);
    }

    private PaymentIntentResult createPaymentIntent(PaymentIntentRequest request, PaymentMethod method) {
        validate(request);
        String applicationId = request.getApplicationId();

        if (!rateLimiter.tryAcquire(request.getCustomerId(), applicationId)) {
            throw new RateLimitExceededException(RATE_LIMIT_MESSAGE,
                    rateLimiter.retryAfter(request.getCustomerId(), applicationId));
        }

        if (velocityEnabled) {
            VelocityVerdict verdict = velocityService.check(VelocityCheckRequest.builder()
                    .userId(request.getUserId())
                    .email(request.getEmail())
                    .ipAddress(request.getClientIp())
                    .amount(request.getAmount())
                    .cardFingerprint(request.getCardFingerprint())
                    .build());
            if (!verdict.isAllowed()) {
                metrics.recordFailure(method, VELOCITY_CHECK_FAILED);
                auditLogger.logRejection(request, method, VELOCITY_CHECK_FAILED, verdict.getRiskScore());
                throw new SecurityRejectionException(verdict.getRiskScore(), verdict.getViolations());
            }
        }

        metrics.recordAttempt(method);
        String idempotencyKey = idempotencyKey(method, request);

        Optional<PaymentIntentResult> cached = idempotencyService.getCachedIntentResult(idempotencyKey);
        if (cached.isPresent()) {
            log.info("Returning existing payment intent {} for idempotencyKey={}",
                    cached.get().getPaymentIntentId(), idempotencyKey);
            return cached.get();
        }

        if (!paymentClaim.tryClaim(applicationId, idempotencyKey)) {
            throw new PaymentConflictException(PAYMENT_IN_PROGRESS_MESSAGE, null);
        }
        try {
            Optional<PaymentIntentEntity> open = intentPersistence.findOpenIntent(applicationId);
            if (open.isPresent()) {
                log.warn("Application {} already has open payment intent {} (idempotencyKey={}); rejecting new {} intent",
                        applicationId, open.get().getPaymentIntentId(), open.get().getIdempotencyKey(), method);
                throw new PaymentConflictException(PAYMENT_IN_PROGRESS_MESSAGE, open.get().getPaymentIntentId());
            }
            return createAtProvider(request, method, idempotencyKey);
        } finally {
            paymentClaim.release(applicationId, idempotencyKey);
        }
    }

    private PaymentIntentResult createAtProvider(PaymentIntentRequest request, PaymentMethod method, String idempotencyKey) {
        auditLogger.logAttempt(request, method, idempotencyKey);
        long start = clock.millis();
        try {
            ProviderPaymentIntent intent = call(method.getOperationClass(),
                    () -> provider.createPaymentIntent(request, method, idempotencyKey));
            PaymentIntentResult result = toResult(request, method, idempotencyKey, intent);
            intentPersistence.recordCreated(result, request.getCustomerId());
            idempotencyService.storeIntentResult(idempotencyKey, result);
            metrics.recordSuccess(method, clock.millis() - start);
            auditLogger.logResult(result);
            log.info("Payment intent {} created for application {} method={} status={} in {}ms",
                    result.getPaymentIntentId(), request.getApplicationId(), method, result.getStatus(),
                    clock.millis() - start);
            return result;
        } catch (ProviderException e) {
            metrics.recordFailure(method, e.getCode());
            PaymentIntentResult failure = PaymentIntentResult.failure(request, method, idempotencyKey,
                    ProviderErrorMessages.forCode(e.getCode()), e.getCode(), e.getType());
            auditLogger.logResult(failure);
            return failure;
        } catch (ProviderUnavailableException e) {
            metrics.recordFailure(method, PROVIDER_UNAVAILABLE);
            throw e;
        }
    }

    /**
     * {@code pi_{method}_{applicationId}_{customerId}}, suffixed with the number of
     * closed intents of the application so a new attempt after a failed payment gets
     * a fresh key. Identical input and state always give the same key.
     */
    public String idempotencyKey(PaymentMethod method, PaymentIntentRequest request) {
        String key = "pi_" + method.getProviderType() + "_" + request.getApplicationId() + "_" + request.getCustomerId();
        long closed = intentPersistence.countClosedIntents(request.getApplicationId());
        return closed > 0 ? key + "_" + closed : key;
    }

    public Optional<ProviderPaymentIntent> retrievePaymentIntent(String paymentIntentId) {
        return retrievePaymentIntent(paymentIntentId, methodOf(paymentIntentId));
    }

    public Optional<ProviderPaymentIntent> retrievePaymentIntent(String paymentIntentId, PaymentMethod method) {
        requireIntentId(paymentIntentId);
        return call(method.getOperationClass(), () -> provider.retrievePaymentIntent(paymentIntentId));
    }

    public ProviderPaymentIntent confirmPaymentIntent(String paymentIntentId, PaymentMethod method) {
        requireIntentId(paymentIntentId);
        log.info("Confirming payment intent {}", paymentIntentId);
        return call(method.getOperationClass(), () -> provider.confirmPaymentIntent(paymentIntentId));
    }

    public ProviderPaymentIntent capturePaymentIntent(String paymentIntentId, PaymentMethod method) {
        requireIntentId(paymentIntentId);
        log.info("Capturing payment intent {}", paymentIntentId);
        return call(method.getOperationClass(), () -> provider.capturePaymentIntent(paymentIntentId));
    }

    /**
     * Verifies the signature of a raw webhook delivery and extracts the event.
     * Fails closed when no signing secret is configured.
     */
    public WebhookEvent constructWebhookEvent(byte[] rawPayload, String signatureHeader) {
        String payload = new String(rawPayload, StandardCharsets.UTF_8);
        signatureVerifier.verify(payload, signatureHeader);
        return parseWebhookEvent(payload);
    }

    /** Extracts the event from an already verified payload, e.g. a stored one being retried. */
    public WebhookEvent parseWebhookEvent(String payload) {
        try {
            JsonNode root = objectMapper.readTree(payload);
            String eventId = text(root, "id");
            String type = text(root, "type");
            if (eventId == null || type == null) {
                throw new PaymentValidationException("Webhook event is missing id or type");
            }
            JsonNode object = root.path("data").path("object");
            WebhookEvent.WebhookEventBuilder event = WebhookEvent.builder()
                    .eventId(eventId)
                    .type(type)
                    .created(root.hasNonNull("created") ? Instant.ofEpochSecond(root.get("created").asLong()) : null)
                    .payload(payload);
            if ("payment_intent".equals(text(object, "object"))) {
                Map<String, String> metadata = new HashMap<>();
                object.path("metadata").fields().forEachRemaining(e -> metadata.put(e.getKey(), e.getValue().asText()));
                event.paymentIntentId(text(object, "id"))
                        .intentStatus(text(object, "status"))
                        .metadata(metadata)
                        .lastPaymentError(text(object.path("last_payment_error"), "message"))
                        .lastPaymentErrorCode(text(object.path("last_payment_error"), "code"));
            }
            return event.build();
        } catch (JsonProcessingException e) {
            throw new PaymentValidationException("Malformed webhook payload");
        }
    }

    private <T> T call(OperationClass operationClass, Supplier<T> call) {
        try {
            return circuitBreakers.executeWithRetry(operationClass, call);
        } catch (CallNotPermittedException e) {
            log.warn("Circuit open for {}; provider call rejected", operationClass);
            throw new ProviderUnavailableException(operationClass,
                    "El servicio de pagos no está disponible temporalmente. Por favor, intente más tarde.", e);
        } catch (ProviderException e) {
            if (e.isTransient()) {
                log.error("Provider unavailable for {} after retries: code={}, message={}",
                        operationClass, e.getCode(), e.getMessage());
                throw new ProviderUnavailableException(operationClass,
                        "El servicio de pagos no está disponible temporalmente. Por favor, intente más tarde.", e);
            }
            throw e;
        }
    }

    private PaymentIntentResult toResult(PaymentIntentRequest request, PaymentMethod method,
                                         String idempotencyKey, ProviderPaymentIntent intent) {
        CashVoucherDetails voucher = null;
        if (method == PaymentMethod.CASH_VOUCHER) {
            voucher = intent.getVoucher();
            if (voucher == null || voucher.getReference() == null) {
                log.error("OXXO intent {} has no voucher reference; status={}", intent.getId(), intent.getStatus());
                throw new ProviderException("OXXO voucher details missing for " + intent.getId(),
                        "voucher_unavailable", "api_error", null, false, null);
            }
            if (voucher.getExpiresAt() == null) {
                Instant created = intent.getCreated() != null ? intent.getCreated() : clock.instant();
                voucher = CashVoucherDetails.builder()
                        .reference(voucher.getReference())
                        .hostedVoucherUrl(voucher.getHostedVoucherUrl())
                        .expiresAt(created.plus(Duration.ofDays(cashVoucherExpiryDays)))
                        .build();
            }
        }
        return PaymentIntentResult.builder()
                .success(true)
                .applicationId(request.getApplicationId())
                .paymentIntentId(intent.getId())
                .idempotencyKey(idempotencyKey)
                .status(intent.getStatus())
                .method(method)
                .amount(intent.getAmount() != null ? intent.getAmount() : request.getAmount())
                .currency(intent.getCurrency() != null ? intent.getCurrency() : request.getCurrency())
                .clientSecret(intent.getClientSecret())
                .created(intent.getCreated())
                .voucher(voucher)
                .build();
    }

    private PaymentMethod methodOf(String paymentIntentId) {
        return intentPersistence.findByPaymentIntentId(paymentIntentId)
                .map(PaymentIntentEntity::getMethod)
                .orElse(PaymentMethod.CARD);
    }

    private static void validate(PaymentIntentRequest request) {
        if (request == null) {
            throw new PaymentValidationException("Payment request is required");
        }
        if (request.getApplicationId() == null || request.getApplicationId().isBlank()) {
            throw new PaymentValidationException("applicationId is required");
        }
        if (request.getCustomerId() == null || request.getCustomerId().isBlank()) {
            throw new PaymentValidationException("customerId is required");
        }
        if (request.getAmount() == null || request.getAmount().compareTo(BigDecimal.ZERO) <= 0) {
            throw new PaymentValidationException("amount must be greater than zero");
        }
        if (request.getCurrency() == null || request.getCurrency().length() != 3) {
            throw new PaymentValidationException("currency must be a 3-letter ISO code");
        }
    }

    private static void requireIntentId(String paymentIntentId) {
        if (paymentIntentId == null || paymentIntentId.isBlank()) {
            throw new PaymentValidationException("paymentIntentId is required");
        }
    }

    private static String customerIdempotencyKey(String normalizedEmail) {
        return "cus_" + DigestUtils.md5DigestAsHex(normalizedEmail.getBytes(StandardCharsets.UTF_8));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
