package com.payment.stripe.codec;

import com.payment.stripe.domain.Account;
import com.payment.stripe.domain.BitcoinReceiver;
import com.payment.stripe.domain.Card;
import com.payment.stripe.domain.Charge;
import com.payment.stripe.domain.Customer;
import com.payment.stripe.domain.StripeObject;
import com.payment.stripe.domain.Transfer;

public class StripeObjectDeserializer extends DiscriminatedUnionDeserializer<StripeObject> {

    public static final DiscriminatorRegistry<StripeObject> REGISTRY = DiscriminatorRegistry.builder(StripeObject.class)
            .variant("customer", Customer.class)
            .variant("card", Card.class)
            .variant("charge", Charge.class)
            .variant("transfer", Transfer.class)
            .variant("account", Account.class)
            .variant("bitcoin_receiver", BitcoinReceiver.class)
            .build();

    public StripeObjectDeserializer() {
        super(REGISTRY);
    }
}
