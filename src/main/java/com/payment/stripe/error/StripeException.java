package com.payment.stripe.error;

/**
 * Base of every failure the client surfaces. Asynchronous operations complete their future
 * exceptionally with one of these.
 */
public abstract class StripeException extends RuntimeException {

    protected StripeException(String message) {
        super(message);
    }

    protected StripeException(String message, Throwable cause) {
        super(message, cause);
    }
}
