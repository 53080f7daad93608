package com.payment.stripe.codec;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.deser.std.StdScalarDeserializer;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdScalarSerializer;

import java.io.IOException;
import java.time.Instant;

/**
 * Stripe timestamps are integer seconds since the epoch, in both directions.
 */
public class EpochSecondsModule extends SimpleModule {

    public EpochSecondsModule() {
        super("StripeEpochSeconds");
        addSerializer(Instant.class, new EpochSecondsSerializer());
        addDeserializer(Instant.class, new EpochSecondsDeserializer());
    }

    static class EpochSecondsSerializer extends StdScalarSerializer<Instant> {

        EpochSecondsSerializer() {
            super(Instant.class);
        }

        @Override
        public void serialize(Instant value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            gen.writeNumber(value.getEpochSecond());
        }
    }

    static class EpochSecondsDeserializer extends StdScalarDeserializer<Instant> {

        EpochSecondsDeserializer() {
            super(Instant.class);
        }

        @Override
        public Instant deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
            JsonToken token = parser.currentToken();
            if (token == JsonToken.VALUE_NUMBER_INT) {
                return Instant.ofEpochSecond(parser.getLongValue());
            }
            if (token == JsonToken.VALUE_STRING) {
                String text = parser.getText().trim();
                try {
                    return Instant.ofEpochSecond(Long.parseLong(text));
                } catch (NumberFormatException e) {
                    return (Instant) ctxt.handleWeirdStringValue(Instant.class, text, "expected epoch seconds");
                }
            }
            return (Instant) ctxt.handleUnexpectedToken(Instant.class, parser);
        }
    }
}
