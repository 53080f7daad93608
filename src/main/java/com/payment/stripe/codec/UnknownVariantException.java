package com.payment.stripe.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;

/**
 * Raised when a discriminated union sees a discriminator value it has no decoder for.
 * Decoding never falls back to a default variant.
 */
public class UnknownVariantException extends JsonMappingException {

    private final Class<?> unionType;
    private final String discriminator;

    public UnknownVariantException(JsonParser parser, Class<?> unionType, String field, String discriminator) {
        super(parser, discriminator == null
                ? "Missing '" + field + "' discriminator for " + unionType.getSimpleName()
                : "Unknown " + unionType.getSimpleName() + " variant '" + discriminator + "'");
        this.unionType = unionType;
        this.discriminator = discriminator;
    }

    public Class<?> getUnionType() {
        return unionType;
    }

    /** The value that was found, or {@code null} when the field was missing. */
    public String getDiscriminator() {
        return discriminator;
    }
}
