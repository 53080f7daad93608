package com.payment.stripe.error;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorParamsTest {

    @ParameterizedTest
    @CsvSource({
            "exp_month, expMonth",
            "amount, amount",
            "legal_entity[first_name], legalEntity[firstName]",
            "source[address_line1], source[addressLine1]",
            "metadata[_private], metadata[_private]"
    })
    void snakeCaseParamBecomesFieldName(String param, String expected) {
        assertThat(ErrorParams.toFieldName(param)).isEqualTo(expected);
    }

    @Test
    void nullStaysNull() {
        assertThat(ErrorParams.toFieldName(null)).isNull();
    }
}
