package com.permit.payment.config;

import com.permit.payment.provider.MockPaymentProviderClient;
import com.permit.payment.provider.PaymentProviderClient;
import com.permit.payment.provider.StripePaymentProviderClient;
import com.permit.payment.provider.WebhookSignatureVerifier;
import com.stripe.StripeClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Payment provider wiring. {@code payment.provider.mode=stripe} talks to Stripe,
 * {@code mock} (default) keeps everything in memory.
 */
@Slf4j
@Configuration
public class ProviderConfig {

    @Value("${payment.provider.cash-voucher-expiry-days:2}")
    private long cashVoucherExpiryDays;

    @Bean
    @ConditionalOnProperty(name = "payment.provider.mode", havingValue = "stripe")
    public StripeClient stripeClient(
            @Value("${payment.provider.stripe.api-key}") String apiKey,
            @Value("${payment.provider.stripe.connect-timeout:10s}") Duration connectTimeout,
            @Value("${payment.provider.stripe.read-timeout:30s}") Duration readTimeout,
            @Value("${payment.provider.stripe.max-network-retries:2}") int maxNetworkRetries) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("payment.provider.stripe.api-key is required when payment.provider.mode=stripe");
        }
        log.info("Stripe client configured: connectTimeout={}, readTimeout={}, maxNetworkRetries={}",
                connectTimeout, readTimeout, maxNetworkRetries);
        return StripeClient.builder()
                .setApiKey(apiKey)
                .setConnectTimeout((int) connectTimeout.toMillis())
                .setReadTimeout((int) readTimeout.toMillis())
                .setMaxNetworkRetries(maxNetworkRetries)
                .build();
    }

    @Bean
    @ConditionalOnProperty(name = "payment.provider.mode", havingValue = "stripe")
    public PaymentProviderClient stripePaymentProviderClient(StripeClient stripeClient) {
        return new StripePaymentProviderClient(stripeClient, cashVoucherExpiryDays);
    }

    @Bean
    @ConditionalOnProperty(name = "payment.provider.mode", havingValue = "mock", matchIfMissing = true)
    public PaymentProviderClient mockPaymentProviderClient(Clock clock) {
        log.warn("Using the in-memory mock payment provider; no real charges will be made");
        return new MockPaymentProviderClient(clock, Duration.ofDays(cashVoucherExpiryDays));
    }

    @Bean
    public WebhookSignatureVerifier webhookSignatureVerifier(
            @Value("${payment.webhook.secret:}") String secret,
            @Value("${payment.webhook.tolerance-seconds:300}") long toleranceSeconds) {
        return new WebhookSignatureVerifier(secret, toleranceSeconds);
    }
}
