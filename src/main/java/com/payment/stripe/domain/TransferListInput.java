package com.payment.stripe.domain;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TransferListInput {

    ListFilterInput created;
    ListFilterInput date;
    String destination;
    String recipient;
    TransferStatus status;

    @JsonUnwrapped
    @Builder.Default
    ListParams page = ListParams.DEFAULT;
}
