package com.payment.stripe.core;

import com.payment.stripe.error.ErrorKind;
import com.payment.stripe.error.TransientServerError;
import com.payment.stripe.error.TypedError;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which failures may be reissued with the same idempotency key. The table is by error type, not
 * by HTTP status: a card error or an authentication error is never retried.
 */
public final class RetryClassification {

    private static final Set<ErrorKind> RETRYABLE_KINDS = EnumSet.of(ErrorKind.API_ERROR, ErrorKind.API_CONNECTION_ERROR);

    private RetryClassification() {}

    public static boolean isRetryable(Throwable error) {
        if (error instanceof TypedError.TooManyRequests) {
            return true;
        }
        if (error instanceof TypedError) {
            return RETRYABLE_KINDS.contains(((TypedError) error).getKind());
        }
        return error instanceof TransientServerError;
    }
}
