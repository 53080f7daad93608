package com.payment.stripe.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

import java.io.IOException;

/**
 * Decodes a JSON object into the variant its discriminator field names. A missing field or an
 * unregistered value fails with {@link UnknownVariantException}.
 *
 * @param <T> the union supertype
 */
public abstract class DiscriminatedUnionDeserializer<T> extends StdDeserializer<T> {

    private final DiscriminatorRegistry<T> registry;

    protected DiscriminatedUnionDeserializer(DiscriminatorRegistry<T> registry) {
        super(registry.getUnionType());
        this.registry = registry;
    }

    @Override
    public T deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonNode node = ctxt.readTree(parser);
        if (!node.isObject()) {
            return ctxt.reportInputMismatch(this, "Expected JSON object for %s but got %s",
                    registry.getUnionType().getSimpleName(), node.getNodeType());
        }
        JsonNode tag = node.get(registry.getField());
        if (tag == null || !tag.isTextual()) {
            throw new UnknownVariantException(parser, registry.getUnionType(), registry.getField(), null);
        }
        Class<? extends T> variant = registry.lookup(tag.asText())
                .orElseThrow(() -> new UnknownVariantException(parser, registry.getUnionType(), registry.getField(), tag.asText()));
        return ctxt.readTreeAsValue(node, variant);
    }
}
