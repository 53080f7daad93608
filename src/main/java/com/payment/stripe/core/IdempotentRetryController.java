package com.payment.stripe.core;

import com.payment.stripe.domain.IdempotencyKey;
import com.payment.stripe.error.MaxRetriesExceeded;
import com.payment.stripe.error.StripeException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Runs one logical call as a sequence of attempts: {@code Attempting(n)} until the call succeeds,
 * fails with an error outside {@link RetryClassification}, or runs out of attempts.
 *
 * <p>Attempts never overlap; attempt n+1 is scheduled only after attempt n has been classified.
 * Idempotent calls get one {@link IdempotencyKey} that is passed unchanged to every attempt.
 * Cancelling the returned future stops any further attempt; a request already in flight is left
 * to finish, which the idempotency key makes harmless.
 */
@Slf4j
public class IdempotentRetryController {

    public static final String RETRY_INSTANCE = "stripe";

    private final Retry retry;
    private final ScheduledExecutorService scheduler;

    public IdempotentRetryController(Retry retry, ScheduledExecutorService scheduler) {
        this.retry = retry;
        this.scheduler = scheduler;
        retry.getEventPublisher()
                .onRetry(event -> log.warn("Stripe call failed on attempt {}, retrying in {}: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));
    }

    /**
     * Retry policy allowing {@code numberOfRetries} retries after the first attempt, with
     * exponential backoff between them.
     */
    public static RetryConfig retryConfig(int numberOfRetries, Duration initialInterval, double multiplier) {
        if (numberOfRetries < 0) {
            throw new IllegalArgumentException("numberOfRetries must be >= 0, was " + numberOfRetries);
        }
        return RetryConfig.custom()
                .maxAttempts(numberOfRetries + 1)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialInterval, multiplier))
                .retryOnException(RetryClassification::isRetryable)
                .build();
    }

    /** Retries without an idempotency key. Meant for reads. */
    public <T> CompletableFuture<T> handle(Supplier<CompletableFuture<T>> request) {
        return run("-", request);
    }

    /** Mints one key for this logical call and reuses it on every attempt. */
    public <T> CompletableFuture<T> handleIdempotent(Function<IdempotencyKey, CompletableFuture<T>> request) {
        return handleIdempotent(IdempotencyKey.random(), request);
    }

    /** Reuses the caller's key verbatim on every attempt. */
    public <T> CompletableFuture<T> handleIdempotent(IdempotencyKey key, Function<IdempotencyKey, CompletableFuture<T>> request) {
        return run(key.getValue(), () -> request.apply(key));
    }

    public int getMaxAttempts() {
        return retry.getRetryConfig().getMaxAttempts();
    }

    private <T> CompletableFuture<T> run(String idempotencyKey, Supplier<CompletableFuture<T>> request) {
        CompletableFuture<T> result = new CompletableFuture<>();
        AtomicInteger attempts = new AtomicInteger();

        Supplier<CompletionStage<T>> attempt = () -> {
            if (result.isDone()) {
                log.info("Stripe call cancelled before attempt {} idempotencyKey={}", attempts.get(), idempotencyKey);
                return CompletableFuture.failedFuture(new CancellationException("Cancelled by caller"));
            }
            int n = attempts.getAndIncrement();
            log.debug("Stripe call Attempting({}) idempotencyKey={}", n, idempotencyKey);
            return request.get();
        };

        Retry.decorateCompletionStage(retry, scheduler, attempt).get()
                .whenComplete((value, error) -> {
                    if (error == null) {
                        log.debug("Stripe call succeeded after {} attempt(s) idempotencyKey={}", attempts.get(), idempotencyKey);
                        result.complete(value);
                        return;
                    }
                    Throwable cause = unwrap(error);
                    if (RetryClassification.isRetryable(cause)) {
                        log.warn("Stripe call gave up after {} attempts idempotencyKey={}: {}",
                                attempts.get(), idempotencyKey, cause.getMessage());
                        result.completeExceptionally(new MaxRetriesExceeded(attempts.get(), (StripeException) cause));
                    } else {
                        if (!(cause instanceof CancellationException)) {
                            log.info("Stripe call failed terminally on attempt {} idempotencyKey={}: {}",
                                    attempts.get(), idempotencyKey, cause.getMessage());
                        }
                        result.completeExceptionally(cause);
                    }
                });
        return result;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
