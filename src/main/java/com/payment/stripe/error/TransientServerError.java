package com.payment.stripe.error;

import java.net.URI;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * A 500/502/503/504 response, or an I/O failure before any response arrived.
 * Always safe to retry with the same idempotency key.
 */
public class TransientServerError extends StripeException {

    private final URI url;
    private final Integer httpStatus;
    private final String rawBody;

    public TransientServerError(URI url, int httpStatus, String rawBody) {
        super("Transient server error " + httpStatus + " from " + url);
        this.url = url;
        this.httpStatus = httpStatus;
        this.rawBody = rawBody;
    }

    private TransientServerError(URI url, Throwable cause) {
        super("Connection to " + url + " failed: " + cause.getMessage(), cause);
        this.url = url;
        this.httpStatus = null;
        this.rawBody = null;
    }

    public static TransientServerError connectionFailure(URI url, Throwable cause) {
        return new TransientServerError(url, cause);
    }

    public static boolean isTransientStatus(int httpStatus) {
        return httpStatus == 500 || httpStatus == 502 || httpStatus == 503 || httpStatus == 504;
    }

    public URI getUrl() {
        return url;
    }

    /** Empty for connection failures. */
    public OptionalInt getHttpStatus() {
        return httpStatus == null ? OptionalInt.empty() : OptionalInt.of(httpStatus);
    }

    public Optional<String> getRawBody() {
        return Optional.ofNullable(rawBody);
    }
}
