package com.permit.payment.provider;

import java.util.Set;

/**
 * Error reported by (or while reaching) the payment provider. Transient errors
 * (network, timeout, rate limiting, 5xx) are retried and counted by the circuit
 * breaker; the rest are mapped to a customer-facing message.
 */
public class ProviderException extends RuntimeException {

    public static final String RESOURCE_ALREADY_EXISTS = "resource_already_exists";
    public static final String RESOURCE_MISSING = "resource_missing";

    private static final Set<String> DECLINE_CODES = Set.of(
            "card_declined", "insufficient_funds", "expired_card", "incorrect_cvc",
            "invalid_number", "invalid_expiry_month", "invalid_expiry_year",
            "invalid_cvc", "lost_card", "stolen_card", "authentication_required");

    private final String code;
    private final String type;
    private final Integer httpStatus;
    private final boolean transientError;

    public ProviderException(String message, String code, String type, Integer httpStatus,
                             boolean transientError, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.type = type;
        this.httpStatus = httpStatus;
        this.transientError = transientError;
    }

    public static ProviderException transientError(String message, Throwable cause) {
        return new ProviderException(message, "api_connection_error", "api_connection_error", null, true, cause);
    }

    public String getCode() {
        return code;
    }

    public String getType() {
        return type;
    }

    public Integer getHttpStatus() {
        return httpStatus;
    }

    public boolean isTransient() {
        return transientError;
    }

    /** Caused by the customer's card, not by the provider being unhealthy. */
    public boolean isDecline() {
        return code != null && DECLINE_CODES.contains(code);
    }
}
