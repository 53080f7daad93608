package com.payment.stripe.error;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The {@code error.type} field of an error body.
 */
public enum ErrorKind {

    API_CONNECTION_ERROR("api_connection_error"),
    API_ERROR("api_error"),
    AUTHENTICATION_ERROR("authentication_error"),
    CARD_ERROR("card_error"),
    INVALID_REQUEST_ERROR("invalid_request_error"),
    RATE_LIMIT_ERROR("rate_limit_error");

    private final String id;

    ErrorKind(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static ErrorKind fromId(String id) {
        return Arrays.stream(values())
                .filter(kind -> kind.id.equalsIgnoreCase(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown error type: " + id));
    }
}
