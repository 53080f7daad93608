package com.payment.stripe.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ChargeStatus {
    @JsonProperty("succeeded")
    SUCCEEDED,
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("failed")
    FAILED
}
