package com.permit.payment.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Permit application statuses this layer reads or writes. The application workflow
 * itself belongs to the permit subsystem.
 */
public enum ApplicationStatus {
    PENDING_PAYMENT,
    AWAITING_OXXO_PAYMENT,
    PAYMENT_PROCESSING,
    PAYMENT_FAILED,
    PAYMENT_RECEIVED,
    APPROVED,
    PERMIT_READY,
    COMPLETED,
    CANCELLED,
    UNKNOWN;

    private static final Set<ApplicationStatus> CAPTURE_ALLOWED =
            EnumSet.of(APPROVED, PAYMENT_PROCESSING, PAYMENT_RECEIVED);

    private static final Set<ApplicationStatus> PAST_PAYMENT =
            EnumSet.of(PAYMENT_RECEIVED, APPROVED, PERMIT_READY, COMPLETED);

    /** An authorized intent for an application in this status may be captured automatically. */
    public boolean allowsAutomaticCapture() {
        return CAPTURE_ALLOWED.contains(this);
    }

    /** The application already moved past payment; payment updates must not move it back. */
    public boolean isPastPayment() {
        return PAST_PAYMENT.contains(this);
    }

    public static ApplicationStatus fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return UNKNOWN;
        }
    }

    /** Application status that follows from a provider intent status. */
    public static ApplicationStatus forIntentStatus(IntentStatus status, PaymentMethod method) {
        switch (status) {
            case SUCCEEDED:
                return PAYMENT_RECEIVED;
            case PROCESSING:
            case REQUIRES_CAPTURE:
                return PAYMENT_PROCESSING;
            case CANCELED:
            case FAILED:
                return PAYMENT_FAILED;
            default:
                return method == PaymentMethod.CASH_VOUCHER ? AWAITING_OXXO_PAYMENT : PENDING_PAYMENT;
        }
    }
}
