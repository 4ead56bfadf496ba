package com.permit.payment.core;

import java.util.Map;

/**
 * Customer-facing (Spanish) messages for provider error codes. Unknown codes get
 * the generic message.
 */
public final class ProviderErrorMessages {

    public static final String GENERIC =
            "Error al procesar el pago. Por favor, intente nuevamente o contacte soporte.";

    private static final Map<String, String> MESSAGES = Map.of(
            "card_declined", "Su tarjeta fue rechazada. Por favor, verifique los datos o intente con otra tarjeta.",
            "insufficient_funds", "Fondos insuficientes en su tarjeta. Por favor, intente con otra tarjeta.",
            "expired_card", "Su tarjeta ha expirado. Por favor, verifique la fecha de vencimiento.",
            "incorrect_cvc", "El código de seguridad (CVC) es incorrecto. Por favor, verifíquelo.",
            "invalid_number", "El número de tarjeta es inválido. Por favor, verifíquelo.",
            "invalid_expiry_month", "La fecha de vencimiento es inválida. Por favor, verifíquela.",
            "invalid_expiry_year", "La fecha de vencimiento es inválida. Por favor, verifíquela.",
            "processing_error", "Error al procesar el pago. Por favor, intente nuevamente.",
            "rate_limit_error", "Demasiadas solicitudes. Por favor, espere un momento e intente nuevamente.");

    private ProviderErrorMessages() {}

    public static String forCode(String code) {
        if (code == null) {
            return GENERIC;
        }
        return MESSAGES.getOrDefault(code, GENERIC);
    }
}
