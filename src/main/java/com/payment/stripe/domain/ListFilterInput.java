package com.payment.stripe.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.payment.stripe.codec.ListFilterInputDeserializer;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Filter for list endpoints that accept a timestamp ({@code created}, {@code date}).
 * Either an exact {@link Timestamp} or a {@link Range} with optional bounds.
 * On the wire a number is a timestamp and an object is a range.
 */
@JsonDeserialize(using = ListFilterInputDeserializer.class)
public interface ListFilterInput {

    static Timestamp at(Instant instant) {
        return new Timestamp(instant);
    }

    @Value
    class Timestamp implements ListFilterInput {

        @NonNull
        Instant timestamp;

        @JsonValue
        public Instant getTimestamp() {
            return timestamp;
        }
    }

    @Value
    @Builder
    @Jacksonized
    class Range implements ListFilterInput {
        Instant gt;
        Instant gte;
        Instant lt;
        Instant lte;
    }
}
