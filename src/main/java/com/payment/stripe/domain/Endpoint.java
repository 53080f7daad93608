package com.payment.stripe.domain;

import lombok.NonNull;
import lombok.Value;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.Map;

/**
 * Base URL of the Stripe API, e.g. {@code https://api.stripe.com}. Trailing slashes are dropped.
 */
@Value
public class Endpoint {

    public static final Endpoint DEFAULT = new Endpoint("https://api.stripe.com");

    String url;

    public Endpoint(@NonNull String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Endpoint URL must not be empty");
        }
        this.url = trimmed;
    }

    /**
     * Builds an encoded URI below this endpoint. Each segment is encoded on its own, so ids
     * containing reserved characters stay within their segment.
     */
    public URI resolve(String... pathSegments) {
        return resolve(Map.of(), false, pathSegments);
    }

    /**
     * Builds an encoded URI with query parameters. Bracketed keys such as {@code created[gt]}
     * are percent-encoded. {@code include[]=total_count} is appended when requested.
     */
    public URI resolve(Map<String, String> query, boolean includeTotalCount, String... pathSegments) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(url).pathSegment(pathSegments);
        if (includeTotalCount) {
            builder.queryParam("include[]", "total_count");
        }
        query.forEach((name, value) -> builder.queryParam(name, value));
        return builder.build().encode().toUri();
    }
}
