package com.payment.stripe.resources;

import com.payment.stripe.core.IdempotentRetryController;
import com.payment.stripe.core.RequestExecutor;
import com.payment.stripe.domain.Charge;
import com.payment.stripe.domain.ChargeInput;
import com.payment.stripe.domain.ChargeListInput;
import com.payment.stripe.domain.IdempotencyKey;
import com.payment.stripe.domain.ListEnvelope;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

@Slf4j
public class ChargeService extends StripeResource {

    public ChargeService(RequestExecutor executor, IdempotentRetryController retries, Validator validator) {
        super(executor, retries, validator);
    }

    public CompletableFuture<Charge> create(ChargeInput input) {
        return create(input, IdempotencyKey.random());
    }

    /** Creates a charge; every retry carries {@code idempotencyKey}. */
    public CompletableFuture<Charge> create(ChargeInput input, IdempotencyKey idempotencyKey) {
        return validated(input, () -> {
            log.debug("Creating charge amount={} currency={} idempotencyKey={}", input.getAmount(), input.getCurrency(), idempotencyKey);
            return retries.handleIdempotent(idempotencyKey,
                    key -> executor.post(uri("v1", "charges"), form(input), Charge.class, key));
        });
    }

    public CompletableFuture<Charge> get(String id) {
        return retries.handle(() -> executor.get(uri("v1", "charges", id), Charge.class));
    }

    public CompletableFuture<ListEnvelope<Charge>> list(ChargeListInput input) {
        return retries.handle(() -> executor.get(listUri(input, input.getPage(), "v1", "charges"), listOf(Charge.class), null));
    }
}
