package com.payment.stripe.codec;

import com.payment.stripe.domain.BitcoinReceiver;
import com.payment.stripe.domain.Card;
import com.payment.stripe.domain.PaymentSource;

public class PaymentSourceDeserializer extends DiscriminatedUnionDeserializer<PaymentSource> {

    public static final DiscriminatorRegistry<PaymentSource> REGISTRY = DiscriminatorRegistry.builder(PaymentSource.class)
            .variant("card", Card.class)
            .variant("bitcoin_receiver", BitcoinReceiver.class)
            .build();

    public PaymentSourceDeserializer() {
        super(REGISTRY);
    }
}
