package com.permit.payment.domain;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class VelocityCheckRequest {

    String userId;
    String email;
    String ipAddress;
    BigDecimal amount;
    String cardFingerprint;
}
