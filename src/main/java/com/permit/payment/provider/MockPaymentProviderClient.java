package com.permit.payment.provider;

import com.permit.payment.domain.CashVoucherDetails;
import com.permit.payment.domain.IntentStatus;
import com.permit.payment.domain.PaymentIntentRequest;
import com.permit.payment.domain.PaymentMethod;
import com.permit.payment.domain.ProviderCustomer;
import com.permit.payment.domain.ProviderPaymentIntent;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory provider for local runs without provider credentials. Honors idempotency
 * keys like the real provider. Card payment method ids {@code pm_card_chargeDeclined}
 * and {@code pm_card_insufficientFunds} simulate declines.
 */
@Slf4j
public class MockPaymentProviderClient implements PaymentProviderClient {

    private final Map<String, ProviderCustomer> customersByEmail = new ConcurrentHashMap<>();
    private final Map<String, ProviderPaymentIntent> intentsById = new ConcurrentHashMap<>();
    private final Map<String, String> intentIdsByIdempotencyKey = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration voucherExpiry;

    public MockPaymentProviderClient(Clock clock, Duration voucherExpiry) {
        this.clock = clock;
        this.voucherExpiry = voucherExpiry;
    }

    @Override
    public String getName() {
        return "mock";
    }

    @Override
    public Optional<ProviderCustomer> findCustomerByEmail(String email) {
        return Optional.ofNullable(customersByEmail.get(email));
    }

    @Override
    public ProviderCustomer createCustomer(String name, String email, String phone, String idempotencyKey) {
        return customersByEmail.computeIfAbsent(email, e -> ProviderCustomer.builder()
                .id("cus_mock_" + shortId())
                .name(name)
                .email(e)
                .phone(phone)
                .build());
    }

    @Override
    public ProviderPaymentIntent createPaymentIntent(PaymentIntentRequest request, PaymentMethod method,
                                                     String idempotencyKey) {
        String pm = request.getPaymentMethodId();
        if ("pm_card_chargeDeclined".equals(pm)) {
            throw new ProviderException("Your card was declined.", "card_declined", "card_error", 402, false, null);
        }
        if ("pm_card_insufficientFunds".equals(pm)) {
            throw new ProviderException("Your card has insufficient funds.", "insufficient_funds", "card_error", 402, false, null);
        }
        String intentId = intentIdsByIdempotencyKey.computeIfAbsent(idempotencyKey, k -> {
            ProviderPaymentIntent intent = newIntent(request, method);
            intentsById.put(intent.getId(), intent);
            log.info("Mock provider created payment intent {} for application {}", intent.getId(), request.getApplicationId());
            return intent.getId();
        });
        return intentsById.get(intentId);
    }

    private ProviderPaymentIntent newIntent(PaymentIntentRequest request, PaymentMethod method) {
        Instant now = clock.instant();
        String id = "pi_mock_" + shortId();
        ProviderPaymentIntent.ProviderPaymentIntentBuilder builder = ProviderPaymentIntent.builder()
                .id(id)
                .paymentMethod(request.getPaymentMethodId())
                .amount(request.getAmount())
                .currency(request.getCurrency().toLowerCase(Locale.ROOT))
                .clientSecret(id + "_secret_" + shortId())
                .created(now)
                .metadata(Map.of("application_id", request.getApplicationId()));
        if (method == PaymentMethod.CASH_VOUCHER) {
            builder.status(IntentStatus.REQUIRES_ACTION)
                    .voucher(CashVoucherDetails.builder()
                            .reference(String.valueOf(Math.abs(id.hashCode())))
                            .hostedVoucherUrl("https://payments.example.test/vouchers/" + id)
                            .expiresAt(now.plus(voucherExpiry))
                            .build());
        } else {
            builder.status(request.getPaymentMethodId() != null ? IntentStatus.SUCCEEDED : IntentStatus.REQUIRES_PAYMENT_METHOD);
        }
        return builder.build();
    }

    @Override
    public Optional<ProviderPaymentIntent> retrievePaymentIntent(String paymentIntentId) {
        return Optional.ofNullable(intentsById.get(paymentIntentId));
    }

    @Override
    public ProviderPaymentIntent confirmPaymentIntent(String paymentIntentId) {
        return updateStatus(paymentIntentId, IntentStatus.SUCCEEDED);
    }

    @Override
    public ProviderPaymentIntent capturePaymentIntent(String paymentIntentId) {
        return updateStatus(paymentIntentId, IntentStatus.SUCCEEDED);
    }

    private ProviderPaymentIntent updateStatus(String paymentIntentId, IntentStatus status) {
        ProviderPaymentIntent updated = intentsById.computeIfPresent(paymentIntentId,
                (id, intent) -> intent.toBuilder().status(status).build());
        if (updated == null) {
            throw new ProviderException("No such payment_intent: " + paymentIntentId,
                    ProviderException.RESOURCE_MISSING, "invalid_request_error", 404, false, null);
        }
        return updated;
    }

    private static String shortId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 16);
    }
}
