package com.payment.stripe.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings under {@code stripe.client}:
 * <pre>{@code
 * stripe:
 *   client:
 *     api-key: sk_test_...
 *     number-of-retries: 3
 *     retry:
 *       initial-interval: 500ms
 *       multiplier: 2.0
 * }</pre>
 */
@Data
@Validated
@ConfigurationProperties("stripe.client")
public class StripeClientProperties {

    /** Secret key; the client is only configured when this is set. */
    @NotBlank
    private String apiKey;

    @NotBlank
    private String endpoint = "https://api.stripe.com";

    /** Optional {@code Stripe-Version} header value. */
    private String apiVersion;

    /** Retries after the first attempt, for retryable failures only. */
    @Min(0)
    private int numberOfRetries = 3;

    @NotNull
    private Duration connectTimeout = Duration.ofSeconds(10);

    @NotNull
    private Duration readTimeout = Duration.ofSeconds(80);

    @Valid
    private final Retry retry = new Retry();

    @Valid
    private final Executor executor = new Executor();

    @Data
    public static class Retry {

        @NotNull
        private Duration initialInterval = Duration.ofMillis(500);

        @DecimalMin("1.0")
        private double multiplier = 2.0;
    }

    @Data
    public static class Executor {

        /** Threads running HTTP calls. */
        @Min(1)
        private int poolSize = 8;

        /** Threads scheduling retry backoff. */
        @Min(1)
        private int schedulerPoolSize = 1;
    }
}
