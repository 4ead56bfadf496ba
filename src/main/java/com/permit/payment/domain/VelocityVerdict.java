package com.permit.payment.domain;

import lombok.Value;

import java.util.List;

@Value
public class VelocityVerdict {

    private static final int MAX_RISK_SCORE = 100;

    boolean allowed;
    int riskScore;
    List<VelocityViolation> violations;

    public static VelocityVerdict allow() {
        return new VelocityVerdict(true, 0, List.of());
    }

    public static VelocityVerdict of(List<VelocityViolation> violations) {
        int score = violations.stream().mapToInt(v -> v.getSeverity().getScore()).sum();
        return new VelocityVerdict(violations.isEmpty(), Math.min(score, MAX_RISK_SCORE), List.copyOf(violations));
    }

    public boolean hasHighSeverity() {
        return violations.stream().anyMatch(v -> v.getSeverity() == VelocityViolation.Severity.HIGH);
    }
}
