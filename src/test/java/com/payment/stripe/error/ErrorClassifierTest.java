package com.payment.stripe.error;

import com.payment.stripe.Fixtures;
import com.payment.stripe.codec.WireCodec;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorClassifierTest {

    private static final URI URL = URI.create("https://api.stripe.com/v1/charges");
    private static final Map<String, String> PARAMS = Map.of("amount", "100");

    private final ErrorClassifier classifier = new ErrorClassifier(new WireCodec());

    @ParameterizedTest
    @ValueSource(ints = {200, 201, 204})
    void successStatusesAreNotErrors(int status) {
        assertThat(classifier.classify(status, "{}", URL, PARAMS)).isEmpty();
    }

    @ParameterizedTest
    @CsvSource({
            "400, com.payment.stripe.error.TypedError$BadRequest",
            "401, com.payment.stripe.error.TypedError$Unauthorized",
            "402, com.payment.stripe.error.TypedError$RequestFailed",
            "404, com.payment.stripe.error.TypedError$NotFound",
            "429, com.payment.stripe.error.TypedError$TooManyRequests"
    })
    void typedStatusesDecodeToMatchingVariant(int status, Class<?> expected) {
        String body = Fixtures.error("invalid_request_error", null, "No such charge");

        StripeException error = classifier.classify(status, body, URL, PARAMS).orElseThrow();

        assertThat(error).isExactlyInstanceOf(expected);
        TypedError typed = (TypedError) error;
        assertThat(typed.getHttpStatus()).isEqualTo(status);
        assertThat(typed.getKind()).isEqualTo(ErrorKind.INVALID_REQUEST_ERROR);
        assertThat(typed.getErrorMessage()).contains("No such charge");
        assertThat(typed.getCode()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(ints = {500, 502, 503, 504})
    void serverErrorsAreTransientWithoutDecodingBody(int status) {
        StripeException error = classifier.classify(status, "<html>Bad gateway</html>", URL, PARAMS).orElseThrow();

        assertThat(error).isInstanceOf(TransientServerError.class);
        TransientServerError transientError = (TransientServerError) error;
        assertThat(transientError.getHttpStatus()).hasValue(status);
        assertThat(transientError.getRawBody()).contains("<html>Bad gateway</html>");
    }

    @ParameterizedTest
    @ValueSource(ints = {301, 403, 409, 418, 501})
    void otherStatusesAreFatal(int status) {
        StripeException error = classifier.classify(status, "teapot", URL, PARAMS).orElseThrow();

        assertThat(error).isInstanceOf(FatalProtocolError.class);
        FatalProtocolError fatal = (FatalProtocolError) error;
        assertThat(fatal.getHttpStatus()).isEqualTo(status);
        assertThat(fatal.getUrl()).isEqualTo(URL);
        assertThat(fatal.getParams()).isEqualTo(PARAMS);
        assertThat(fatal.getRawBody()).isEqualTo("teapot");
    }

    @Test
    void cardErrorCarriesCodeMessageAndParam() {
        Optional<StripeException> error = classifier.classify(402, Fixtures.load("error_card_declined.json"), URL, PARAMS);

        assertThat(error).containsInstanceOf(TypedError.RequestFailed.class);
        TypedError typed = (TypedError) error.get();
        assertThat(typed.getKind()).isEqualTo(ErrorKind.CARD_ERROR);
        assertThat(typed.getCode()).contains(ErrorCode.CARD_DECLINED);
        assertThat(typed.getParam()).contains("exp_month");
        assertThat(typed.getFieldName()).contains("expMonth");
        assertThat(typed.getMessage()).contains("402").contains("card_declined");
    }

    @Test
    void errorKindAndCodeAreCaseInsensitive() {
        String body = Fixtures.error("Card_Error", "EXPIRED_CARD", null);

        TypedError typed = (TypedError) classifier.classify(402, body, URL, PARAMS).orElseThrow();

        assertThat(typed.getKind()).isEqualTo(ErrorKind.CARD_ERROR);
        assertThat(typed.getCode()).contains(ErrorCode.EXPIRED_CARD);
    }

    @Test
    void undecodableErrorBodyIsFatalWithCause() {
        StripeException error = classifier.classify(400, "{\"message\":\"not an error envelope\"}", URL, PARAMS).orElseThrow();

        assertThat(error).isInstanceOf(FatalProtocolError.class);
        assertThat(error.getCause()).isNotNull();
        assertThat(((FatalProtocolError) error).getHttpStatus()).isEqualTo(400);
    }

    @Test
    void unknownErrorTypeIsFatal() {
        String body = Fixtures.error("quantum_error", null, null);

        assertThat(classifier.classify(400, body, URL, PARAMS)).containsInstanceOf(FatalProtocolError.class);
    }

    @Test
    void unknownErrorCodeIsFatal() {
        String body = Fixtures.error("card_error", "card_on_fire", null);

        assertThat(classifier.classify(402, body, URL, PARAMS)).containsInstanceOf(FatalProtocolError.class);
    }
}
