package com.payment.stripe.error;

import com.payment.stripe.codec.DecodeException;
import com.payment.stripe.codec.WireCodec;
import lombok.RequiredArgsConstructor;

import java.net.URI;
import java.util.Map;
import java.util.Optional;

/**
 * Turns an HTTP status and body into the matching {@link StripeException}.
 * <ul>
 *   <li>2xx: no error</li>
 *   <li>400/401/402/404/429: the {@link TypedError} variant, decoded from the {@code error} object</li>
 *   <li>500/502/503/504: {@link TransientServerError}, body not decoded</li>
 *   <li>anything else, or an error body that does not decode: {@link FatalProtocolError}</li>
 * </ul>
 */
@RequiredArgsConstructor
public class ErrorClassifier {

    private final WireCodec codec;

    public Optional<StripeException> classify(int status, String body, URI url, Map<String, String> params) {
        if (status >= 200 && status < 300) {
            return Optional.empty();
        }
        if (TypedError.isTypedStatus(status)) {
            try {
                ErrorEnvelope envelope = codec.decode(body, ErrorEnvelope.class);
                return Optional.of(TypedError.of(status, envelope.getError()));
            } catch (DecodeException e) {
                return Optional.of(FatalProtocolError.undecodableBody(url, params, status, body, e));
            }
        }
        if (TransientServerError.isTransientStatus(status)) {
            return Optional.of(new TransientServerError(url, status, body));
        }
        return Optional.of(FatalProtocolError.unhandledStatus(url, params, status, body));
    }
}
