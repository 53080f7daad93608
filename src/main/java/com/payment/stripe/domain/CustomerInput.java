package com.payment.stripe.domain;

import jakarta.validation.constraints.Email;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class CustomerInput {

    @Email
    String email;
    String description;
    String coupon;
    /** Token or card to attach as the default source. */
    ChargeSource source;
    Map<String, String> metadata;
}
