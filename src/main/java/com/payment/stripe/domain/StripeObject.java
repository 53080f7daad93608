package com.payment.stripe.domain;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.payment.stripe.codec.StripeObjectDeserializer;

/**
 * Supertype of every top-level Stripe resource. Decoding dispatches on the {@code object}
 * field of the JSON body and fails for values that are not registered.
 */
@JsonDeserialize(using = StripeObjectDeserializer.class)
public interface StripeObject {

    String getId();
}
