package com.permit.payment.domain;

import lombok.Value;

/** A single behavioral limit that a payment attempt exceeded. */
@Value
public class VelocityViolation {

    public enum Severity {
        LOW(10), MEDIUM(25), HIGH(50);

        private final int score;

        Severity(int score) {
            this.score = score;
        }

        public int getScore() {
            return score;
        }
    }

    String rule;
    Severity severity;
    long count;
    long limit;
}
