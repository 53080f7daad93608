package com.payment.stripe.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class Customer implements StripeObject {

    @NonNull
    String id;
    @NonNull
    Instant created;
    String email;
    String description;
    String defaultSource;
    Boolean livemode;
    Boolean delinquent;
    Long accountBalance;
    String currency;
    /** Attached cards and bitcoin receivers. */
    ListEnvelope<PaymentSource> sources;
    Map<String, String> metadata;
}
