package com.payment.stripe.domain;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Parameters for creating a charge. Either {@code source} or {@code customer} identifies
 * what is charged.
 */
@Value
@Builder
public class ChargeInput {

    @NotNull
    @Positive
    Long amount;

    /** Three-letter ISO currency code, lower case. */
    @NotBlank
    String currency;

    Long applicationFee;
    Boolean capture;
    String description;
    String destination;
    String customer;
    String receiptEmail;

    ChargeSource source;

    @StatementDescriptor
    String statementDescriptor;

    Map<String, String> metadata;
}
