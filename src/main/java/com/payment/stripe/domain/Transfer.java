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
public class Transfer implements StripeObject {

    @NonNull
    String id;
    @NonNull
    Long amount;
    Long amountReversed;
    @NonNull
    String currency;
    @NonNull
    Instant created;
    Instant date;
    String destination;
    String description;
    TransferStatus status;
    SourceType sourceType;
    String sourceTransaction;
    String statementDescriptor;
    String failureCode;
    String failureMessage;
    Boolean livemode;
    Map<String, String> metadata;
}
