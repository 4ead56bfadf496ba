package com.permit.payment.domain;

/**
 * Groups of provider operations that fail independently. Every class gets its own
 * circuit breaker so an outage of one payment method does not block the others.
 */
public enum OperationClass {
    CARD_PAYMENT("card-payment", 3, 60),
    CASH_VOUCHER_PAYMENT("cash-voucher-payment", 3, 60),
    CUSTOMER_OPERATIONS("customer-operations", 5, 30),
    WEBHOOK_PROCESSING("webhook-processing", 10, 120),
    RECOVERY("recovery", 5, 60);

    private final String configKey;
    private final int defaultFailureThreshold;
    private final long defaultCooldownSeconds;

    OperationClass(String configKey, int defaultFailureThreshold, long defaultCooldownSeconds) {
        this.configKey = configKey;
        this.defaultFailureThreshold = defaultFailureThreshold;
        this.defaultCooldownSeconds = defaultCooldownSeconds;
    }

    /** Key under {@code payment.circuit-breaker.*} and the breaker instance name. */
    public String getConfigKey() {
        return configKey;
    }

    public int getDefaultFailureThreshold() {
        return defaultFailureThreshold;
    }

    public long getDefaultCooldownSeconds() {
        return defaultCooldownSeconds;
    }
}
