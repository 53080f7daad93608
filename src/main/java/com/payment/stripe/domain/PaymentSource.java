package com.payment.stripe.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.payment.stripe.codec.PaymentSourceDeserializer;

/**
 * A source attached to a customer or used by a charge: a {@link Card} or a
 * {@link BitcoinReceiver}, told apart by the {@code object} field.
 */
@JsonDeserialize(using = PaymentSourceDeserializer.class)
public interface PaymentSource extends StripeObject {
}
