package com.payment.stripe.compliance;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CardDataMaskerTest {

    @Test
    void apiKeyKeepsOnlyModePrefix() {
        assertThat(CardDataMasker.maskApiKey("sk_test_4eC39HqLyjWDarjtT1zdp7dc")).isEqualTo("sk_test_****");
        assertThat(CardDataMasker.maskApiKey("sk_live_abc")).isEqualTo("sk_live_****");
        assertThat(CardDataMasker.maskApiKey("opaque-secret")).isEqualTo("****");
        assertThat(CardDataMasker.maskApiKey(" ")).isNull();
    }

    @Test
    void cardNumberKeepsLastFour() {
        assertThat(CardDataMasker.maskCardNumber("4242 4242 4242 4242")).isEqualTo("****4242");
        assertThat(CardDataMasker.maskCardNumber("123")).isEqualTo("****");
    }

    @Test
    void formParamsMaskNumberAndCvcAtAnyDepth() {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("amount", "2000");
        params.put("source[number]", "4000000000000002");
        params.put("source[cvc]", "314");
        params.put("number", "4242424242424242");
        params.put("metadata[phone_number]", "555-0100");

        Map<String, String> masked = CardDataMasker.maskFormParams(params);

        assertThat(masked)
                .containsEntry("amount", "2000")
                .containsEntry("source[number]", "****0002")
                .containsEntry("source[cvc]", "***")
                .containsEntry("number", "****4242")
                .containsEntry("metadata[phone_number]", "555-0100");
        assertThat(params).containsEntry("source[cvc]", "314");
    }
}
