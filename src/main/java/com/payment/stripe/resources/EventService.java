package com.payment.stripe.resources;

import com.payment.stripe.core.IdempotentRetryController;
import com.payment.stripe.core.RequestExecutor;
import com.payment.stripe.domain.Event;
import jakarta.validation.Validator;

import java.util.concurrent.CompletableFuture;

public class EventService extends StripeResource {

    public EventService(RequestExecutor executor, IdempotentRetryController retries, Validator validator) {
        super(executor, retries, validator);
    }

    /** The event's {@code data.object} is decoded by its {@code object} discriminator. */
    public CompletableFuture<Event> get(String id) {
        return retries.handle(() -> executor.get(uri("v1", "events", id), Event.class));
    }
}
