package com.payment.stripe.error;

import lombok.AccessLevel;
import lombok.Getter;

import java.util.Optional;

/**
 * A structured error the API returned on purpose. The concrete class is chosen by HTTP status
 * alone; the body supplies kind, code, message and param.
 */
@Getter
public abstract class TypedError extends StripeException {

    private final int httpStatus;
    private final ErrorKind kind;
    @Getter(AccessLevel.NONE)
    private final ErrorCode code;
    @Getter(AccessLevel.NONE)
    private final String errorMessage;
    @Getter(AccessLevel.NONE)
    private final String param;

    protected TypedError(int httpStatus, ErrorBody body) {
        super(describe(httpStatus, body));
        this.httpStatus = httpStatus;
        this.kind = body.getType();
        this.code = body.getCode();
        this.errorMessage = body.getMessage();
        this.param = body.getParam();
    }

    private static String describe(int httpStatus, ErrorBody body) {
        StringBuilder sb = new StringBuilder()
                .append(httpStatus).append(' ').append(body.getType().getId());
        if (body.getCode() != null) sb.append(" [").append(body.getCode().getId()).append(']');
        if (body.getMessage() != null) sb.append(": ").append(body.getMessage());
        if (body.getParam() != null) sb.append(" (param ").append(body.getParam()).append(')');
        return sb.toString();
    }

    /**
     * Picks the variant for {@code httpStatus}.
     *
     * @throws IllegalArgumentException if the status has no typed variant
     */
    public static TypedError of(int httpStatus, ErrorBody body) {
        switch (httpStatus) {
            case 400:
                return new BadRequest(body);
            case 401:
                return new Unauthorized(body);
            case 402:
                return new RequestFailed(body);
            case 404:
                return new NotFound(body);
            case 429:
                return new TooManyRequests(body);
            default:
                throw new IllegalArgumentException("No typed error for status " + httpStatus);
        }
    }

    public static boolean isTypedStatus(int httpStatus) {
        return httpStatus == 400 || httpStatus == 401 || httpStatus == 402 || httpStatus == 404 || httpStatus == 429;
    }

    public Optional<ErrorCode> getCode() {
        return Optional.ofNullable(code);
    }

    public Optional<String> getErrorMessage() {
        return Optional.ofNullable(errorMessage);
    }

    public Optional<String> getParam() {
        return Optional.ofNullable(param);
    }

    /** {@link #getParam()} translated to the input field name. */
    public Optional<String> getFieldName() {
        return getParam().map(ErrorParams::toFieldName);
    }

    /** 400: missing or malformed parameters. */
    public static final class BadRequest extends TypedError {
        public BadRequest(ErrorBody body) {
            super(400, body);
        }
    }

    /** 401: no valid API key. */
    public static final class Unauthorized extends TypedError {
        public Unauthorized(ErrorBody body) {
            super(401, body);
        }
    }

    /** 402: parameters were valid but the request failed, typically a card error. */
    public static final class RequestFailed extends TypedError {
        public RequestFailed(ErrorBody body) {
            super(402, body);
        }
    }

    /** 404 */
    public static final class NotFound extends TypedError {
        public NotFound(ErrorBody body) {
            super(404, body);
        }
    }

    /** 429: rate limited. */
    public static final class TooManyRequests extends TypedError {
        public TooManyRequests(ErrorBody body) {
            super(429, body);
        }
    }
}
