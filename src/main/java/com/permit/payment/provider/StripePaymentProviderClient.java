package com.permit.payment.provider;

import com.permit.payment.domain.CashVoucherDetails;
import com.permit.payment.domain.IntentStatus;
import com.permit.payment.domain.PaymentIntentRequest;
import com.permit.payment.domain.PaymentMethod;
import com.permit.payment.domain.ProviderCustomer;
import com.permit.payment.domain.ProviderPaymentIntent;
import com.stripe.StripeClient;
import com.stripe.exception.ApiConnectionException;
import com.stripe.exception.StripeException;
import com.stripe.model.Customer;
import com.stripe.model.PaymentIntent;
import com.stripe.net.RequestOptions;
import com.stripe.param.CustomerCreateParams;
import com.stripe.param.CustomerListParams;
import com.stripe.param.PaymentIntentCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Stripe implementation of {@link PaymentProviderClient}. Timeouts and network
 * retries are configured on the injected {@link StripeClient}.
 */
@Slf4j
@RequiredArgsConstructor
public class StripePaymentProviderClient implements PaymentProviderClient {

    private static final BigDecimal MINOR_UNITS = BigDecimal.valueOf(100);

    private final StripeClient stripeClient;
    private final long cashVoucherExpiryDays;

    @Override
    public String getName() {
        return "stripe";
    }

    @Override
    public Optional<ProviderCustomer> findCustomerByEmail(String email) {
        try {
            CustomerListParams params = CustomerListParams.builder()
                    .setEmail(email)
                    .setLimit(1L)
                    .build();
            List<Customer> customers = stripeClient.customers().list(params).getData();
            return customers.isEmpty() ? Optional.empty() : Optional.of(toCustomer(customers.get(0)));
        } catch (StripeException e) {
            throw translate("customer lookup", e);
        }
    }

    @Override
    public ProviderCustomer createCustomer(String name, String email, String phone, String idempotencyKey) {
        try {
            CustomerCreateParams.Builder params = CustomerCreateParams.builder()
                    .setName(name)
                    .setEmail(email)
                    .putMetadata("source", "permit-payments");
            if (phone != null && !phone.isBlank()) {
                params.setPhone(phone);
            }
            Customer customer = stripeClient.customers().create(params.build(), options(idempotencyKey));
            log.info("Created Stripe customer {}", customer.getId());
            return toCustomer(customer);
        } catch (StripeException e) {
            throw translate("customer creation", e);
        }
    }

    @Override
    public ProviderPaymentIntent createPaymentIntent(PaymentIntentRequest request, PaymentMethod method,
                                                     String idempotencyKey) {
        PaymentIntentCreateParams.Builder params = PaymentIntentCreateParams.builder()
                .setAmount(toMinorUnits(request.getAmount()))
                .setCurrency(request.getCurrency().toLowerCase(Locale.ROOT))
                .setCustomer(request.getCustomerId())
                .setDescription(request.getDescription())
                .addPaymentMethodType(method.getProviderType())
                .putMetadata("application_id", request.getApplicationId())
                .putMetadata("payment_method", method.getProviderType());
        if (request.getMetadata() != null) {
            params.putAllMetadata(request.getMetadata());
        }
        if (method == PaymentMethod.CARD) {
            if (request.getPaymentMethodId() != null) {
                params.setPaymentMethod(request.getPaymentMethodId());
            }
        } else {
            params.setConfirm(true)
                    .setPaymentMethodData(PaymentIntentCreateParams.PaymentMethodData.builder()
                            .setType(PaymentIntentCreateParams.PaymentMethodData.Type.OXXO)
                            .setBillingDetails(PaymentIntentCreateParams.PaymentMethodData.BillingDetails.builder()
                                    .setName(request.getCustomerName())
                                    .setEmail(request.getEmail())
                                    .build())
                            .build())
                    .setPaymentMethodOptions(PaymentIntentCreateParams.PaymentMethodOptions.builder()
                            .setOxxo(PaymentIntentCreateParams.PaymentMethodOptions.Oxxo.builder()
                                    .setExpiresAfterDays(cashVoucherExpiryDays)
                                    .build())
                            .build());
        }
        try {
            PaymentIntent intent = stripeClient.paymentIntents().create(params.build(), options(idempotencyKey));
            log.info("Created Stripe payment intent {} status={} method={}", intent.getId(), intent.getStatus(), method);
            return toIntent(intent);
        } catch (StripeException e) {
            throw translate("payment intent creation", e);
        }
    }

    @Override
    public Optional<ProviderPaymentIntent> retrievePaymentIntent(String paymentIntentId) {
        try {
            return Optional.of(toIntent(stripeClient.paymentIntents().retrieve(paymentIntentId)));
        } catch (StripeException e) {
            if (ProviderException.RESOURCE_MISSING.equals(e.getCode())) {
                return Optional.empty();
            }
            throw translate("payment intent retrieval", e);
        }
    }

    @Override
    public ProviderPaymentIntent confirmPaymentIntent(String paymentIntentId) {
        try {
            return toIntent(stripeClient.paymentIntents().confirm(paymentIntentId));
        } catch (StripeException e) {
            throw translate("payment intent confirmation", e);
        }
    }

    @Override
    public ProviderPaymentIntent capturePaymentIntent(String paymentIntentId) {
        try {
            return toIntent(stripeClient.paymentIntents().capture(paymentIntentId));
        } catch (StripeException e) {
            throw translate("payment intent capture", e);
        }
    }

    private static RequestOptions options(String idempotencyKey) {
        return RequestOptions.builder().setIdempotencyKey(idempotencyKey).build();
    }

    static long toMinorUnits(BigDecimal amount) {
        return amount.multiply(MINOR_UNITS).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    private static ProviderCustomer toCustomer(Customer customer) {
        return ProviderCustomer.builder()
                .id(customer.getId())
                .name(customer.getName())
                .email(customer.getEmail())
                .phone(customer.getPhone())
                .build();
    }

    private static ProviderPaymentIntent toIntent(PaymentIntent intent) {
        Map<String, String> metadata = intent.getMetadata() != null ? new HashMap<>(intent.getMetadata()) : Map.of();
        return ProviderPaymentIntent.builder()
                .id(intent.getId())
                .status(IntentStatus.fromProvider(intent.getStatus()))
                .paymentMethod(intent.getPaymentMethod())
                .amount(intent.getAmount() != null
                        ? BigDecimal.valueOf(intent.getAmount()).divide(MINOR_UNITS, 2, RoundingMode.HALF_UP)
                        : null)
                .currency(intent.getCurrency())
                .clientSecret(intent.getClientSecret())
                .created(intent.getCreated() != null ? Instant.ofEpochSecond(intent.getCreated()) : null)
                .metadata(metadata)
                .voucher(toVoucher(intent))
                .lastPaymentError(intent.getLastPaymentError() != null ? intent.getLastPaymentError().getMessage() : null)
                .lastPaymentErrorCode(intent.getLastPaymentError() != null ? intent.getLastPaymentError().getCode() : null)
                .build();
    }

    private static CashVoucherDetails toVoucher(PaymentIntent intent) {
        return Optional.ofNullable(intent.getNextAction())
                .map(action -> action.getOxxoDisplayDetails())
                .map(details -> CashVoucherDetails.builder()
                        .reference(details.getNumber())
                        .hostedVoucherUrl(details.getHostedVoucherUrl())
                        .expiresAt(details.getExpiresAfter() != null ? Instant.ofEpochSecond(details.getExpiresAfter()) : null)
                        .build())
                .orElse(null);
    }

    /**
     * Network errors, rate limiting and provider 5xx are transient; everything else
     * is a definitive provider answer.
     */
    private static ProviderException translate(String operation, StripeException e) {
        Integer status = e.getStatusCode();
        String type = e.getStripeError() != null ? e.getStripeError().getType() : null;
        boolean transientError = e instanceof ApiConnectionException
                || "rate_limit".equals(e.getCode())
                || "rate_limit_error".equals(type)
                || (status != null && (status == 429 || status >= 500));
        String code = e.getCode();
        if (code == null && e instanceof ApiConnectionException) {
            code = "api_connection_error";
            type = "api_connection_error";
        }
        if (code == null && "rate_limit_error".equals(type)) {
            code = "rate_limit_error";
        }
        if (transientError) {
            log.warn("Transient Stripe error during {}: status={}, code={}, message={}", operation, status, code, e.getMessage());
        } else {
            log.warn("Stripe rejected {}: status={}, code={}, type={}", operation, status, code, type);
        }
        return new ProviderException(e.getMessage(), code, type, status, transientError, e);
    }
}
