package com.payment.stripe.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Body returned by every DELETE endpoint.
 */
@Value
@Builder
@Jacksonized
public class DeleteResponse {

    @NonNull
    String id;

    @NonNull
    Boolean deleted;
}
