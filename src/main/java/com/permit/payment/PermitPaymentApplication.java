package com.permit.payment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the permit payment reliability service. Enables:
 * <ul>
 *   <li>Card and OXXO payment intents through the provider, behind per-operation circuit breakers</li>
 *   <li>Velocity screening and per-application rate limiting before every charge</li>
 *   <li>Signed webhooks with deduplication and a bounded retry schedule</li>
 *   <li>Pull-based recovery and reconciliation of stuck payments</li>
 *   <li>REST API and OpenAPI docs at /swagger-ui/index.html</li>
 * </ul>
 */
@SpringBootApplication
public class PermitPaymentApplication {

    public static void main(String[] args) {
        SpringApplication.run(PermitPaymentApplication.class, args);
    }
}
