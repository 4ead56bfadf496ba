package com.permit.payment.api;

import com.permit.payment.domain.VelocityViolation;

import java.util.List;

/**
 * Velocity/fraud veto. Carries the risk score and violated rules for logging and
 * alerting; the message shown to the customer stays generic.
 */
public class SecurityRejectionException extends RuntimeException {

    public static final String USER_MESSAGE =
            "No fue posible procesar su pago en este momento. Por favor, intente más tarde o contacte soporte.";

    private final int riskScore;
    private final List<VelocityViolation> violations;

    public SecurityRejectionException(int riskScore, List<VelocityViolation> violations) {
        super(USER_MESSAGE);
        this.riskScore = riskScore;
        this.violations = List.copyOf(violations);
    }

    public int getRiskScore() {
        return riskScore;
    }

    public List<VelocityViolation> getViolations() {
        return violations;
    }
}
