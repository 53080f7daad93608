package com.payment.stripe.domain;

import com.payment.stripe.compliance.CardDataMasker;
import lombok.EqualsAndHashCode;
import lombok.NonNull;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Stripe secret API key. Sent as the Basic auth username with an empty password.
 * {@link #toString()} is redacted so the key never ends up in a log line.
 */
@EqualsAndHashCode
public final class ApiKey {

    private final String value;

    public ApiKey(@NonNull String value) {
        if (value.isBlank()) {
            throw new IllegalArgumentException("API key must not be blank");
        }
        this.value = value;
    }

    /** Value for the {@code Authorization} header. */
    public String basicAuthorization() {
        String credentials = value + ":";
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return CardDataMasker.maskApiKey(value);
    }
}
