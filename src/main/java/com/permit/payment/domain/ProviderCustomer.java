package com.permit.payment.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProviderCustomer {

    String id;
    String name;
    String email;
    String phone;
}
