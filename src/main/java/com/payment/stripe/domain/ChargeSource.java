package com.payment.stripe.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.payment.stripe.codec.ChargeSourceDeserializer;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * What a charge is paid with. A JSON string is a {@link Token} (token, card or source id);
 * a JSON object is a full {@link CardObject}.
 */
@JsonDeserialize(using = ChargeSourceDeserializer.class)
public interface ChargeSource {

    static Token token(String id) {
        return new Token(id);
    }

    @Value
    class Token implements ChargeSource {

        @NonNull
        String id;

        @JsonValue
        public String getId() {
            return id;
        }
    }

    @Value
    @Builder
    @Jacksonized
    class CardObject implements ChargeSource {

        @NonNull
        Integer expMonth;
        @NonNull
        Integer expYear;
        @NonNull
        String number;
        String cvc;
        String name;
        String addressLine1;
        String addressLine2;
        String addressCity;
        String addressState;
        String addressZip;
        String addressCountry;

        @JsonProperty("object")
        public String getObject() {
            return "card";
        }

        @Override
        public String toString() {
            return "CardObject(expMonth=" + expMonth + ", expYear=" + expYear + ", name=" + name + ")";
        }
    }
}
