package com.payment.stripe.domain;

import jakarta.validation.constraints.Email;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class AccountInput {

    /** Two-letter country code; defaults to the platform's country. */
    String country;

    @Email
    String email;

    Boolean managed;
    String defaultCurrency;
    LegalEntity legalEntity;
    Map<String, String> metadata;
}
