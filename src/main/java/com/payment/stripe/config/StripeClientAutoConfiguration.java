package com.payment.stripe.config;

import com.payment.stripe.codec.WireCodec;
import com.payment.stripe.core.IdempotentRetryController;
import com.payment.stripe.core.RequestExecutor;
import com.payment.stripe.core.RestTemplateStripeTransport;
import com.payment.stripe.core.StripeContext;
import com.payment.stripe.core.StripeTransport;
import com.payment.stripe.domain.ApiKey;
import com.payment.stripe.domain.Endpoint;
import com.payment.stripe.error.ErrorClassifier;
import com.payment.stripe.resources.AccountService;
import com.payment.stripe.resources.ChargeService;
import com.payment.stripe.resources.CustomerService;
import com.payment.stripe.resources.EventService;
import com.payment.stripe.resources.StripeClient;
import com.payment.stripe.resources.TransferService;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the Stripe client when {@code stripe.client.api-key} is set. Every bean backs off when
 * the application defines its own.
 */
@Slf4j
@AutoConfiguration
@ConditionalOnProperty(prefix = "stripe.client", name = "api-key")
@EnableConfigurationProperties(StripeClientProperties.class)
public class StripeClientAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public WireCodec stripeWireCodec() {
        return new WireCodec(WireCodec.defaultMapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public StripeContext stripeContext(StripeClientProperties properties) {
        log.info("Configuring Stripe client endpoint={} apiKey={} apiVersion={}",
                properties.getEndpoint(), new ApiKey(properties.getApiKey()), properties.getApiVersion());
        return StripeContext.builder()
                .apiKey(new ApiKey(properties.getApiKey()))
                .endpoint(new Endpoint(properties.getEndpoint()))
                .apiVersion(properties.getApiVersion())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public StripeTransport stripeTransport(StripeClientProperties properties) {
        return new RestTemplateStripeTransport(new RestTemplateBuilder()
                .connectTimeout(properties.getConnectTimeout())
                .readTimeout(properties.getReadTimeout())
                .build());
    }

    @Bean(name = "stripeRequestExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "stripeRequestExecutor")
    public ExecutorService stripeRequestExecutor(StripeClientProperties properties) {
        return Executors.newFixedThreadPool(properties.getExecutor().getPoolSize(), threadFactory("stripe-http-"));
    }

    @Bean(name = "stripeRetryScheduler", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "stripeRetryScheduler")
    public ScheduledExecutorService stripeRetryScheduler(StripeClientProperties properties) {
        return Executors.newScheduledThreadPool(properties.getExecutor().getSchedulerPoolSize(), threadFactory("stripe-retry-"));
    }

    @Bean(name = "stripeRetryRegistry")
    @ConditionalOnMissingBean(name = "stripeRetryRegistry")
    public RetryRegistry stripeRetryRegistry(StripeClientProperties properties) {
        return RetryRegistry.of(IdempotentRetryController.retryConfig(
                properties.getNumberOfRetries(),
                properties.getRetry().getInitialInterval(),
                properties.getRetry().getMultiplier()));
    }

    @Bean
    @ConditionalOnMissingBean
    public ErrorClassifier stripeErrorClassifier(WireCodec codec) {
        return new ErrorClassifier(codec);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestExecutor requestExecutor(StripeContext context, StripeTransport transport, WireCodec codec,
                                           ErrorClassifier classifier,
                                           @Qualifier("stripeRequestExecutor") ExecutorService executor) {
        return new RequestExecutor(context, transport, codec, classifier, executor);
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotentRetryController idempotentRetryController(@Qualifier("stripeRetryRegistry") RetryRegistry retryRegistry,
                                                               @Qualifier("stripeRetryScheduler") ScheduledExecutorService scheduler) {
        return new IdempotentRetryController(retryRegistry.retry(IdempotentRetryController.RETRY_INSTANCE), scheduler);
    }

    @Bean
    @ConditionalOnMissingBean
    public Validator stripeInputValidator() {
        return Validation.buildDefaultValidatorFactory().getValidator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ChargeService chargeService(RequestExecutor executor, IdempotentRetryController retries, Validator validator) {
        return new ChargeService(executor, retries, validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public CustomerService customerService(RequestExecutor executor, IdempotentRetryController retries, Validator validator) {
        return new CustomerService(executor, retries, validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public TransferService transferService(RequestExecutor executor, IdempotentRetryController retries, Validator validator) {
        return new TransferService(executor, retries, validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public AccountService accountService(RequestExecutor executor, IdempotentRetryController retries, Validator validator) {
        return new AccountService(executor, retries, validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventService eventService(RequestExecutor executor, IdempotentRetryController retries, Validator validator) {
        return new EventService(executor, retries, validator);
    }

    @Bean
    @ConditionalOnMissingBean
    public StripeClient stripeClient(ChargeService charges, CustomerService customers, TransferService transfers,
                                     AccountService accounts, EventService events) {
        return new StripeClient(charges, customers, transfers, accounts, events);
    }

    private static ThreadFactory threadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
