package com.payment.stripe.error;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** {@code {"error": {...}}} */
@Value
@Builder
@Jacksonized
public class ErrorEnvelope {

    @NonNull
    ErrorBody error;
}
