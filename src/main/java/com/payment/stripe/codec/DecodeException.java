package com.payment.stripe.codec;

/**
 * A JSON body that does not match the expected shape. The cause is the Jackson failure,
 * which may be an {@link UnknownVariantException}.
 */
public class DecodeException extends Exception {

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }

    /** True when decoding failed because a discriminator value was not registered. */
    public boolean isUnknownVariant() {
        return getCause() instanceof UnknownVariantException;
    }
}
