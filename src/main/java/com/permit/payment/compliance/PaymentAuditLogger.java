package com.permit.payment.compliance;

import com.permit.payment.domain.IntentStatus;
import com.permit.payment.domain.PaymentIntentRequest;
import com.permit.payment.domain.PaymentIntentResult;
import com.permit.payment.domain.PaymentMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Audit trail of charge attempts, outcomes and status changes. Lines are prefixed with
 * [AUDIT] so log shipping can route them to the audit store.
 */
@Slf4j
@Component
public class PaymentAuditLogger {

    public void logAttempt(PaymentIntentRequest request, PaymentMethod method, String idempotencyKey) {
        log.info("[AUDIT] PAYMENT_ATTEMPT applicationId={} method={} idempotencyKey={} amount={} currency={} email={} paymentMethod={}",
                request.getApplicationId(),
                method,
                idempotencyKey,
                request.getAmount(),
                request.getCurrency(),
                SensitiveDataMasker.maskEmail(request.getEmail()),
                SensitiveDataMasker.maskPaymentMethodId(request.getPaymentMethodId()));
    }

    public void logResult(PaymentIntentResult result) {
        log.info("[AUDIT] PAYMENT_RESULT applicationId={} method={} paymentIntentId={} success={} status={} errorCode={}",
                result.getApplicationId(),
                result.getMethod(),
                result.getPaymentIntentId(),
                result.isSuccess(),
                result.getStatus(),
                result.getErrorCode());
    }

    public void logRejection(PaymentIntentRequest request, PaymentMethod method, String reason, int riskScore) {
        log.info("[AUDIT] PAYMENT_REJECTED applicationId={} method={} reason={} riskScore={}",
                request.getApplicationId(), method, reason, riskScore);
    }

    public void logStatusChange(String applicationId, String paymentIntentId, IntentStatus from, IntentStatus to,
                                String source) {
        log.info("[AUDIT] PAYMENT_STATUS_CHANGE applicationId={} paymentIntentId={} from={} to={} source={}",
                applicationId, paymentIntentId, from, to, source);
    }
}
