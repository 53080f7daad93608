package com.payment.stripe.core;

import lombok.Value;

@Value
public class TransportResponse {

    int status;
    String body;
}
