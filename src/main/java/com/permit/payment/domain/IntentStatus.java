package com.permit.payment.domain;

import java.util.Locale;

/**
 * Status of a payment intent as reported by the provider, plus the local FAILED
 * outcome. Statuses only move forward: a terminal status is never replaced by a
 * non-terminal observation, and SUCCEEDED always wins because the money was collected.
 */
public enum IntentStatus {
    CANCELED("canceled", 0, true),
    REQUIRES_PAYMENT_METHOD("requires_payment_method", 1, false),
    REQUIRES_CONFIRMATION("requires_confirmation", 2, false),
    REQUIRES_ACTION("requires_action", 3, false),
    REQUIRES_CAPTURE("requires_capture", 4, false),
    PROCESSING("processing", 5, false),
    SUCCEEDED("succeeded", 6, true),
    FAILED("failed", 1, true);

    private final String providerValue;
    private final int priority;
    private final boolean terminal;

    IntentStatus(String providerValue, int priority, boolean terminal) {
        this.providerValue = providerValue;
        this.priority = priority;
        this.terminal = terminal;
    }

    public String getProviderValue() {
        return providerValue;
    }

    public int getPriority() {
        return priority;
    }

    public boolean isTerminal() {
        return terminal;
    }

    /**
     * Whether a record currently in this status should take {@code observed}.
     * Same status, and any non-terminal observation on a terminal record, are no-ops.
     * A different terminal observation on a terminal record is a conflict and is
     * reported through {@link #conflictsWith(IntentStatus)}.
     */
    public boolean shouldAdvanceTo(IntentStatus observed) {
        if (observed == null || observed == this) {
            return false;
        }
        if (observed == SUCCEEDED) {
            return true;
        }
        if (terminal) {
            return false;
        }
        return observed.terminal || observed.priority > priority;
    }

    /** A terminal record observed in a different terminal status, other than SUCCEEDED. */
    public boolean conflictsWith(IntentStatus observed) {
        return terminal && observed != null && observed.terminal
                && observed != this && observed != SUCCEEDED;
    }

    public static IntentStatus fromProvider(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Provider status is null");
        }
        String normalized = value.toLowerCase(Locale.ROOT);
        for (IntentStatus status : values()) {
            if (status.providerValue.equals(normalized)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown provider intent status: " + value);
    }
}
