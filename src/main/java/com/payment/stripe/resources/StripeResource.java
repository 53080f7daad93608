package com.payment.stripe.resources;

import com.fasterxml.jackson.databind.JavaType;
import com.payment.stripe.core.IdempotentRetryController;
import com.payment.stripe.core.RequestExecutor;
import com.payment.stripe.domain.ListEnvelope;
import com.payment.stripe.domain.ListParams;
import com.payment.stripe.error.InvalidInputException;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Shared plumbing for resource services: URL building, form encoding, local validation and
 * routing every call through the retry controller.
 */
@RequiredArgsConstructor(access = AccessLevel.PROTECTED)
abstract class StripeResource {

    protected final RequestExecutor executor;
    protected final IdempotentRetryController retries;
    private final Validator validator;

    protected URI uri(String... segments) {
        return executor.getContext().getEndpoint().resolve(segments);
    }

    /** List URL with the filters of {@code listInput} as query parameters. */
    protected URI listUri(Object listInput, ListParams page, String... segments) {
        Map<String, String> query = executor.getCodec().encodeForm(listInput);
        return executor.getContext().getEndpoint().resolve(query, page != null && page.isIncludeTotalCount(), segments);
    }

    protected Map<String, String> form(Object input) {
        return executor.getCodec().encodeForm(input);
    }

    protected JavaType listOf(Class<?> elementType) {
        return executor.getCodec().getTypeFactory().constructParametricType(ListEnvelope.class, elementType);
    }

    protected JavaType type(Class<?> type) {
        return executor.getCodec().getTypeFactory().constructType(type);
    }

    /** Runs {@code call} only when {@code input} passes validation; otherwise a failed future. */
    protected <I, T> CompletableFuture<T> validated(I input, Supplier<CompletableFuture<T>> call) {
        if (input == null) {
            return CompletableFuture.failedFuture(new InvalidInputException(
                    List.of(new InvalidInputException.FieldViolation("input", "must not be null"))));
        }
        Set<ConstraintViolation<I>> violations = validator.validate(input);
        if (!violations.isEmpty()) {
            return CompletableFuture.failedFuture(InvalidInputException.of(violations));
        }
        return call.get();
    }
}
