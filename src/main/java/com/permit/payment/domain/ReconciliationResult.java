package com.permit.payment.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReconciliationResult {

    public static final String STATUS_UPDATED = "status_updated";
    public static final String STATUS_IN_SYNC = "status_in_sync";
    public static final String NO_PAYMENT_ORDER = "no_payment_order";
    public static final String PAYMENT_INTENT_NOT_FOUND = "payment_intent_not_found";
    public static final String STATUS_CONFLICT = "status_conflict";
    public static final String RECONCILIATION_ERROR = "reconciliation_error";

    boolean success;
    String reason;
    String applicationId;
    String paymentIntentId;
    IntentStatus oldStatus;
    IntentStatus newStatus;
    String error;
}
