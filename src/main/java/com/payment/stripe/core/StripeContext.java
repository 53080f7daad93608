package com.payment.stripe.core;

import com.payment.stripe.domain.ApiKey;
import com.payment.stripe.domain.Endpoint;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * Credential and base URL every request is made with. Read-only, shared by all calls.
 */
@Value
@Builder
public class StripeContext {

    @NonNull
    ApiKey apiKey;
    @NonNull
    @Builder.Default
    Endpoint endpoint = Endpoint.DEFAULT;
    /** Pinned API version, sent as {@code Stripe-Version}. */
    String apiVersion;

    public Optional<String> getApiVersion() {
        return Optional.ofNullable(apiVersion).filter(v -> !v.isBlank());
    }
}
