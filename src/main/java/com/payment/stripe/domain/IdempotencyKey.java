package com.payment.stripe.domain;

import lombok.NonNull;
import lombok.Value;

import java.util.UUID;

/**
 * Opaque token sent as the {@code Idempotency-Key} header. One key belongs to one logical
 * operation and is reused verbatim on every retry of that operation.
 */
@Value
public class IdempotencyKey {

    String value;

    public IdempotencyKey(@NonNull String value) {
        if (value.isBlank()) {
            throw new IllegalArgumentException("Idempotency key must not be blank");
        }
        this.value = value;
    }

    public static IdempotencyKey random() {
        return new IdempotencyKey(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
