package com.payment.stripe.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * A connected account.
 */
@Value
@Builder
@Jacksonized
public class Account implements StripeObject {

    @NonNull
    String id;
    String email;
    String country;
    String defaultCurrency;
    String displayName;
    Boolean managed;
    Boolean chargesEnabled;
    Boolean transfersEnabled;
    Boolean detailsSubmitted;
    LegalEntity legalEntity;
    Map<String, String> metadata;
}
