package com.permit.payment.api;

import com.permit.payment.domain.OperationClass;

/**
 * Thrown when the payment provider cannot be reached: the circuit for the operation
 * class is open, or transient errors persisted after retries.
 * Handler returns HTTP 503 so the client knows to retry later.
 */
public class ProviderUnavailableException extends RuntimeException {

    private final OperationClass operationClass;

    public ProviderUnavailableException(OperationClass operationClass, String message) {
        super(message);
        this.operationClass = operationClass;
    }

    public ProviderUnavailableException(OperationClass operationClass, String message, Throwable cause) {
        super(message, cause);
        this.operationClass = operationClass;
    }

    public OperationClass getOperationClass() {
        return operationClass;
    }
}
