package com.permit.payment.compliance;

/**
 * Redacts customer and card identifiers so they are safe to include in logs.
 */
public final class SensitiveDataMasker {

    private static final String MASKED_PM = "pm_***";

    private SensitiveDataMasker() {}

    /** "juan.perez@example.com" -> "j***@example.com". */
    public static String maskEmail(String email) {
        if (email == null || email.isBlank()) return null;
        int at = email.indexOf('@');
        if (at <= 0) return "***";
        return email.charAt(0) + "***" + email.substring(at);
    }

    /** Returns a safe-to-log value for a payment method id (e.g. "pm_1ABC" -> "pm_***"). */
    public static String maskPaymentMethodId(String paymentMethodId) {
        if (paymentMethodId == null || paymentMethodId.isBlank()) return null;
        return MASKED_PM;
    }

    /** Keeps the last four characters of a card fingerprint. */
    public static String maskFingerprint(String fingerprint) {
        if (fingerprint == null || fingerprint.isBlank()) return null;
        if (fingerprint.length() <= 4) return "****";
        return "****" + fingerprint.substring(fingerprint.length() - 4);
    }
}
