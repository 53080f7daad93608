package com.payment.stripe.core;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;
import org.springframework.http.HttpMethod;

import java.net.URI;
import java.util.Map;

/**
 * One physical HTTP request. {@code form} is null for requests without a body.
 */
@Value
@Builder
public class TransportRequest {

    @NonNull
    HttpMethod method;
    @NonNull
    URI uri;
    @Singular
    Map<String, String> headers;
    Map<String, String> form;
}
