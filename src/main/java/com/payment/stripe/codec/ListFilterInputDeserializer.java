package com.payment.stripe.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.payment.stripe.domain.ListFilterInput;

import java.io.IOException;
import java.time.Instant;

/**
 * A number (or numeric string) is an exact timestamp; an object is a range.
 */
public class ListFilterInputDeserializer extends StdDeserializer<ListFilterInput> {

    public ListFilterInputDeserializer() {
        super(ListFilterInput.class);
    }

    @Override
    public ListFilterInput deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_STRING) {
            return ListFilterInput.at(ctxt.readValue(parser, Instant.class));
        }
        if (token == JsonToken.START_OBJECT) {
            return ctxt.readValue(parser, ListFilterInput.Range.class);
        }
        return (ListFilterInput) ctxt.handleUnexpectedToken(ListFilterInput.class, parser);
    }
}
