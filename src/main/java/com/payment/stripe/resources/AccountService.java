package com.payment.stripe.resources;

import com.payment.stripe.core.IdempotentRetryController;
import com.payment.stripe.core.RequestExecutor;
import com.payment.stripe.domain.Account;
import com.payment.stripe.domain.AccountInput;
import jakarta.validation.Validator;

import java.util.concurrent.CompletableFuture;

public class AccountService extends StripeResource {

    public AccountService(RequestExecutor executor, IdempotentRetryController retries, Validator validator) {
        super(executor, retries, validator);
    }

    public CompletableFuture<Account> create(AccountInput input) {
        return validated(input, () -> retries.handleIdempotent(
                key -> executor.post(uri("v1", "accounts"), form(input), Account.class, key)));
    }

    public CompletableFuture<Account> get(String id) {
        return retries.handle(() -> executor.get(uri("v1", "accounts", id), Account.class));
    }
}
