package com.payment.stripe.error;

import java.net.URI;
import java.util.Map;

/**
 * The response could not be understood: an unhandled status or a body that does not match the
 * expected schema. Never retried. Carries the request and the raw response for debugging.
 */
public class FatalProtocolError extends StripeException {

    private final URI url;
    private final Map<String, String> params;
    private final int httpStatus;
    private final String rawBody;

    public FatalProtocolError(String message, URI url, Map<String, String> params, int httpStatus, String rawBody, Throwable cause) {
        super(message + " [" + httpStatus + " " + url + "]", cause);
        this.url = url;
        this.params = params == null ? Map.of() : Map.copyOf(params);
        this.httpStatus = httpStatus;
        this.rawBody = rawBody;
    }

    public static FatalProtocolError unhandledStatus(URI url, Map<String, String> params, int httpStatus, String rawBody) {
        return new FatalProtocolError("Unhandled status", url, params, httpStatus, rawBody, null);
    }

    public static FatalProtocolError undecodableBody(URI url, Map<String, String> params, int httpStatus, String rawBody, Throwable cause) {
        return new FatalProtocolError("Undecodable body: " + cause.getMessage(), url, params, httpStatus, rawBody, cause);
    }

    public URI getUrl() {
        return url;
    }

    /** Form parameters of the request, already masked. */
    public Map<String, String> getParams() {
        return params;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public String getRawBody() {
        return rawBody;
    }
}
