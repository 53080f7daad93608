package com.payment.stripe.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * A charge as returned by {@code /v1/charges}. Only the fields the client needs are mapped.
 */
@Value
@Builder
@Jacksonized
public class Charge implements StripeObject {

    @NonNull
    String id;
    /** Amount in the smallest currency unit. */
    @NonNull
    Long amount;
    Long amountRefunded;
    @NonNull
    String currency;
    @NonNull
    Instant created;
    Boolean captured;
    Boolean paid;
    Boolean refunded;
    Boolean livemode;
    ChargeStatus status;
    String customer;
    String description;
    String failureCode;
    String failureMessage;
    String receiptEmail;
    String statementDescriptor;
    PaymentSource source;
    Map<String, String> metadata;
}
