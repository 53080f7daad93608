package com.payment.stripe.error;

/**
 * Every attempt of one logical call failed with a retryable error. The last of those errors is
 * the cause.
 */
public class MaxRetriesExceeded extends StripeException {

    private final int attempts;

    public MaxRetriesExceeded(int attempts, StripeException lastError) {
        super("Gave up after " + attempts + " attempts: " + lastError.getMessage(), lastError);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }

    public StripeException getLastError() {
        return (StripeException) getCause();
    }
}
