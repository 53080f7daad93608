package com.payment.stripe.domain;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CustomerListInput {

    ListFilterInput created;

    @JsonUnwrapped
    @Builder.Default
    ListParams page = ListParams.DEFAULT;
}
