package com.payment.stripe.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum TransferStatus {
    @JsonProperty("paid")
    PAID,
    @JsonProperty("pending")
    PENDING,
    @JsonProperty("in_transit")
    IN_TRANSIT,
    @JsonProperty("canceled")
    CANCELED,
    @JsonProperty("failed")
    FAILED
}
