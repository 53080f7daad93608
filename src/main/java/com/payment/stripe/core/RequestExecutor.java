package com.payment.stripe.core;

import com.fasterxml.jackson.databind.JavaType;
import com.payment.stripe.codec.DecodeException;
import com.payment.stripe.codec.WireCodec;
import com.payment.stripe.compliance.CardDataMasker;
import com.payment.stripe.domain.DeleteResponse;
import com.payment.stripe.domain.IdempotencyKey;
import com.payment.stripe.error.ErrorClassifier;
import com.payment.stripe.error.FatalProtocolError;
import com.payment.stripe.error.StripeException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Issues single authenticated requests and turns each response into a decoded value or a
 * classified {@link StripeException}. One call here is one physical attempt; retries live in
 * {@link IdempotentRetryController}.
 *
 * <p>Every method returns immediately. The request runs on the injected {@link Executor} and the
 * future fails with a {@link StripeException} for error responses, I/O failures and bodies that
 * do not decode.
 */
@Slf4j
@RequiredArgsConstructor
public class RequestExecutor {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    public static final String STRIPE_ACCOUNT_HEADER = "Stripe-Account";
    public static final String STRIPE_VERSION_HEADER = "Stripe-Version";

    @Getter
    private final StripeContext context;
    private final StripeTransport transport;
    @Getter
    private final WireCodec codec;
    private final ErrorClassifier classifier;
    private final Executor executor;

    public <T> CompletableFuture<T> get(URI url, Class<T> type) {
        return get(url, codec.getTypeFactory().constructType(type), null);
    }

    public <T> CompletableFuture<T> get(URI url, JavaType type, String stripeAccount) {
        TransportRequest request = baseRequest(HttpMethod.GET, url, null, stripeAccount).build();
        return submit(request, type);
    }

    public <T> CompletableFuture<T> post(URI url, Map<String, String> form, Class<T> type, IdempotencyKey idempotencyKey) {
        return post(url, form, codec.getTypeFactory().constructType(type), idempotencyKey, null);
    }

    /**
     * @param idempotencyKey sent as {@code Idempotency-Key} when not null
     * @param stripeAccount  sent as {@code Stripe-Account} when not null
     */
    public <T> CompletableFuture<T> post(URI url, Map<String, String> form, JavaType type,
                                         IdempotencyKey idempotencyKey, String stripeAccount) {
        TransportRequest request = baseRequest(HttpMethod.POST, url, idempotencyKey, stripeAccount)
                .form(form == null ? Map.of() : form)
                .build();
        return submit(request, type);
    }

    public CompletableFuture<DeleteResponse> delete(URI url, IdempotencyKey idempotencyKey) {
        return delete(url, codec.getTypeFactory().constructType(DeleteResponse.class), idempotencyKey);
    }

    public <T> CompletableFuture<T> delete(URI url, JavaType type, IdempotencyKey idempotencyKey) {
        TransportRequest request = baseRequest(HttpMethod.DELETE, url, idempotencyKey, null).build();
        return submit(request, type);
    }

    private TransportRequest.TransportRequestBuilder baseRequest(HttpMethod method, URI url,
                                                                 IdempotencyKey idempotencyKey, String stripeAccount) {
        TransportRequest.TransportRequestBuilder builder = TransportRequest.builder()
                .method(method)
                .uri(url)
                .header(HttpHeaders.AUTHORIZATION, context.getApiKey().basicAuthorization());
        if (idempotencyKey != null) {
            builder.header(IDEMPOTENCY_KEY_HEADER, idempotencyKey.getValue());
        }
        if (stripeAccount != null) {
            builder.header(STRIPE_ACCOUNT_HEADER, stripeAccount);
        }
        context.getApiVersion().ifPresent(version -> builder.header(STRIPE_VERSION_HEADER, version));
        return builder;
    }

    private <T> CompletableFuture<T> submit(TransportRequest request, JavaType type) {
        return CompletableFuture.supplyAsync(() -> exchange(request, type), executor);
    }

    private <T> T exchange(TransportRequest request, JavaType type) {
        Map<String, String> maskedParams = request.getForm() == null ? Map.of() : CardDataMasker.maskFormParams(request.getForm());
        if (log.isDebugEnabled()) {
            log.debug("Stripe request method={} url={} idempotencyKey={} params={}",
                    request.getMethod(), request.getUri(), request.getHeaders().get(IDEMPOTENCY_KEY_HEADER), maskedParams);
        }

        TransportResponse response = transport.execute(request);
        log.debug("Stripe response method={} url={} status={}", request.getMethod(), request.getUri(), response.getStatus());

        Optional<StripeException> error = classifier.classify(response.getStatus(), response.getBody(), request.getUri(), maskedParams);
        if (error.isPresent()) {
            throw error.get();
        }
        try {
            return codec.decode(response.getBody(), type);
        } catch (DecodeException e) {
            log.warn("Undecodable Stripe response url={} status={} target={}: {}",
                    request.getUri(), response.getStatus(), type.toCanonical(), e.getMessage());
            throw FatalProtocolError.undecodableBody(request.getUri(), maskedParams, response.getStatus(), response.getBody(), e);
        }
    }
}
