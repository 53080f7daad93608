package com.payment.stripe.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class BitcoinReceiver implements PaymentSource {

    @NonNull
    String id;
    Long amount;
    Long amountReceived;
    Long bitcoinAmount;
    Long bitcoinAmountReceived;
    String currency;
    Boolean active;
    Boolean filled;
    String inboundAddress;
    String email;
    Instant created;
}
