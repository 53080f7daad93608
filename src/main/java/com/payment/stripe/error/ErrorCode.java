package com.payment.stripe.error;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The {@code error.code} field: why a card or parameter was rejected.
 */
public enum ErrorCode {

    INVALID_NUMBER("invalid_number"),
    INVALID_EXPIRY_MONTH("invalid_expiry_month"),
    INVALID_EXPIRY_YEAR("invalid_expiry_year"),
    INVALID_CVC("invalid_cvc"),
    INCORRECT_NUMBER("incorrect_number"),
    EXPIRED_CARD("expired_card"),
    INCORRECT_CVC("incorrect_cvc"),
    INCORRECT_ZIP("incorrect_zip"),
    CARD_DECLINED("card_declined"),
    MISSING("missing"),
    PROCESSING_ERROR("processing_error");

    private final String id;

    ErrorCode(String id) {
        this.id = id;
    }

    @JsonValue
    public String getId() {
        return id;
    }

    @JsonCreator
    public static ErrorCode fromId(String id) {
        return Arrays.stream(values())
                .filter(code -> code.id.equalsIgnoreCase(id))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown error code: " + id));
    }
}
