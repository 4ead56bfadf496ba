package com.permit.payment.domain;

public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
