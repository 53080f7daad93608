package com.payment.stripe.error;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * The {@code error} object of an error response.
 */
@Value
@Builder
@Jacksonized
public class ErrorBody {

    @NonNull
    ErrorKind type;
    ErrorCode code;
    String message;
    String param;
}
