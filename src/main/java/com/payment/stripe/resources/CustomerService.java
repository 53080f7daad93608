package com.payment.stripe.resources;

import com.payment.stripe.core.IdempotentRetryController;
import com.payment.stripe.core.RequestExecutor;
import com.payment.stripe.domain.Customer;
import com.payment.stripe.domain.CustomerInput;
import com.payment.stripe.domain.CustomerListInput;
import com.payment.stripe.domain.DeleteResponse;
import com.payment.stripe.domain.ListEnvelope;
import jakarta.validation.Validator;

import java.util.concurrent.CompletableFuture;

public class CustomerService extends StripeResource {

    public CustomerService(RequestExecutor executor, IdempotentRetryController retries, Validator validator) {
        super(executor, retries, validator);
    }

    public CompletableFuture<Customer> create(CustomerInput input) {
        return validated(input, () -> retries.handleIdempotent(
                key -> executor.post(uri("v1", "customers"), form(input), Customer.class, key)));
    }

    public CompletableFuture<Customer> get(String id) {
        return retries.handle(() -> executor.get(uri("v1", "customers", id), Customer.class));
    }

    public CompletableFuture<DeleteResponse> delete(String id) {
        return retries.handleIdempotent(key -> executor.delete(uri("v1", "customers", id), key));
    }

    public CompletableFuture<ListEnvelope<Customer>> list(CustomerListInput input) {
        return retries.handle(() -> executor.get(listUri(input, input.getPage(), "v1", "customers"), listOf(Customer.class), null));
    }
}
