package com.payment.stripe.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * A webhook event. {@code data.object} is decoded to the concrete resource named by its
 * {@code object} field.
 */
@Value
@Builder
@Jacksonized
public class Event implements StripeObject {

    @NonNull
    String id;
    /** e.g. {@code customer.created}. */
    @NonNull
    String type;
    @NonNull
    Instant created;
    Boolean livemode;
    Long pendingWebhooks;
    String request;
    @NonNull
    Data data;

    @Value
    @Builder
    @Jacksonized
    public static class Data {

        @NonNull
        StripeObject object;

        Map<String, Object> previousAttributes;
    }
}
