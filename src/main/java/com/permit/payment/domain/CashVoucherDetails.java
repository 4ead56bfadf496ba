package com.permit.payment.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/** Display details of an OXXO voucher the customer pays at the store. */
@Value
@Builder
@Jacksonized
public class CashVoucherDetails {

    String reference;
    String hostedVoucherUrl;
    Instant expiresAt;
}
