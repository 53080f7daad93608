package com.payment.stripe.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Parameters for creating a transfer. {@code stripeAccount} is not a form field: it is sent as
 * the {@code Stripe-Account} header so the transfer is made on behalf of a connected account.
 */
@Value
@Builder
public class TransferInput {

    @NotNull
    @Positive
    Long amount;

    @NotBlank
    String currency;

    @NotBlank
    String destination;

    String description;
    String sourceTransaction;

    @StatementDescriptor
    String statementDescriptor;

    SourceType sourceType;
    Map<String, String> metadata;

    @JsonIgnore
    String stripeAccount;
}
