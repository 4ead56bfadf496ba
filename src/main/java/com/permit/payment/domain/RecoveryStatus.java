package com.permit.payment.domain;

public enum RecoveryStatus {
    NOT_ATTEMPTED,
    RECOVERING,
    SUCCEEDED,
    FAILED,
    MAX_ATTEMPTS_REACHED
}
