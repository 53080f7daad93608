package com.payment.stripe;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads JSON bodies from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {

    private Fixtures() {}

    public static String load(String name) {
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("No fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String error(String type, String code, String message) {
        StringBuilder sb = new StringBuilder("{\"error\":{\"type\":\"").append(type).append('"');
        if (code != null) sb.append(",\"code\":\"").append(code).append('"');
        if (message != null) sb.append(",\"message\":\"").append(message).append('"');
        return sb.append("}}").toString();
    }
}
