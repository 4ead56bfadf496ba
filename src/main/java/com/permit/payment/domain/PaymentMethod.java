package com.permit.payment.domain;

/**
 * Payment methods accepted for permit fees. Each method has its own provider
 * payment-method type and its own circuit breaker.
 */
public enum PaymentMethod {
    CARD("card", OperationClass.CARD_PAYMENT),
    CASH_VOUCHER("oxxo", OperationClass.CASH_VOUCHER_PAYMENT);

    private final String providerType;
    private final OperationClass operationClass;

    PaymentMethod(String providerType, OperationClass operationClass) {
        this.providerType = providerType;
        this.operationClass = operationClass;
    }

    /** Provider-side payment method type ("card", "oxxo"). */
    public String getProviderType() {
        return providerType;
    }

    public OperationClass getOperationClass() {
        return operationClass;
    }

    public static PaymentMethod fromProviderType(String providerType) {
        for (PaymentMethod method : values()) {
            if (method.providerType.equalsIgnoreCase(providerType)) {
                return method;
            }
        }
        return CARD;
    }
}
