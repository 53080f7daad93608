package com.payment.stripe.codec;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.payment.stripe.domain.ChargeSource;

import java.io.IOException;

/**
 * String means a token/id reference, object means a full card.
 */
public class ChargeSourceDeserializer extends StdDeserializer<ChargeSource> {

    public ChargeSourceDeserializer() {
        super(ChargeSource.class);
    }

    @Override
    public ChargeSource deserialize(JsonParser parser, DeserializationContext ctxt) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_STRING) {
            return ChargeSource.token(parser.getText());
        }
        if (token == JsonToken.START_OBJECT) {
            return ctxt.readValue(parser, ChargeSource.CardObject.class);
        }
        return (ChargeSource) ctxt.handleUnexpectedToken(ChargeSource.class, parser);
    }
}
