package com.payment.stripe.resources;

import com.payment.stripe.core.IdempotentRetryController;
import com.payment.stripe.core.RequestExecutor;
import com.payment.stripe.domain.ListEnvelope;
import com.payment.stripe.domain.Transfer;
import com.payment.stripe.domain.TransferInput;
import com.payment.stripe.domain.TransferListInput;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * Transfers to connected accounts. A transfer with an invalid statement descriptor never
 * reaches the API: the future fails with {@link com.payment.stripe.error.InvalidInputException}.
 */
@Slf4j
public class TransferService extends StripeResource {

    public TransferService(RequestExecutor executor, IdempotentRetryController retries, Validator validator) {
        super(executor, retries, validator);
    }

    public CompletableFuture<Transfer> create(TransferInput input) {
        return validated(input, () -> {
            log.debug("Creating transfer amount={} currency={} destination={} stripeAccount={}",
                    input.getAmount(), input.getCurrency(), input.getDestination(), input.getStripeAccount());
            return retries.handleIdempotent(key -> executor.post(uri("v1", "transfers"), form(input),
                    type(Transfer.class), key, input.getStripeAccount()));
        });
    }

    public CompletableFuture<Transfer> get(String id) {
        return retries.handle(() -> executor.get(uri("v1", "transfers", id), Transfer.class));
    }

    public CompletableFuture<ListEnvelope<Transfer>> list(TransferListInput input) {
        return retries.handle(() -> executor.get(listUri(input, input.getPage(), "v1", "transfers"), listOf(Transfer.class), null));
    }
}
