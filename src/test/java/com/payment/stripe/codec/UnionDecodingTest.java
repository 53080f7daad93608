package com.payment.stripe.codec;

import com.fasterxml.jackson.core.type.TypeReference;
import com.payment.stripe.Fixtures;
import com.payment.stripe.domain.BitcoinReceiver;
import com.payment.stripe.domain.Card;
import com.payment.stripe.domain.Charge;
import com.payment.stripe.domain.ChargeSource;
import com.payment.stripe.domain.ChargeStatus;
import com.payment.stripe.domain.Customer;
import com.payment.stripe.domain.Event;
import com.payment.stripe.domain.ListEnvelope;
import com.payment.stripe.domain.ListFilterInput;
import com.payment.stripe.domain.PaymentSource;
import com.payment.stripe.domain.StripeObject;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class UnionDecodingTest {

    private final WireCodec codec = new WireCodec();

    @Test
    void jsonStringDecodesToTokenVariant() throws Exception {
        ChargeSource source = codec.decode("\"tok_123\"", ChargeSource.class);

        assertThat(source).isEqualTo(ChargeSource.token("tok_123"));
    }

    @Test
    void jsonObjectDecodesToCardVariant() throws Exception {
        String json = "{\"object\":\"card\",\"number\":\"4242424242424242\",\"exp_month\":8,\"exp_year\":2030,\"name\":\"J R\"}";

        ChargeSource source = codec.decode(json, ChargeSource.class);

        assertThat(source).isInstanceOf(ChargeSource.CardObject.class);
        ChargeSource.CardObject card = (ChargeSource.CardObject) source;
        assertThat(card.getNumber()).isEqualTo("4242424242424242");
        assertThat(card.getExpMonth()).isEqualTo(8);
        assertThat(card.getName()).isEqualTo("J R");
    }

    @Test
    void numberIsNeitherTokenNorCard() {
        assertThatThrownBy(() -> codec.decode("42", ChargeSource.class))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    void discriminatorSelectsConcreteStripeObject() throws Exception {
        StripeObject object = codec.decode(Fixtures.load("charge.json"), StripeObject.class);

        assertThat(object).isInstanceOf(Charge.class);
        Charge charge = (Charge) object;
        assertThat(charge.getAmount()).isEqualTo(2000L);
        assertThat(charge.getCreated()).isEqualTo(Instant.ofEpochSecond(1700000000L));
        assertThat(charge.getStatus()).isEqualTo(ChargeStatus.SUCCEEDED);
        assertThat(charge.getSource()).isInstanceOf(Card.class);
        assertThat(((Card) charge.getSource()).getLast4()).isEqualTo("4242");
        assertThat(charge.getMetadata()).containsEntry("order_id", "1042");
    }

    @Test
    void unknownDiscriminatorFailsWithUnknownVariant() {
        String json = "{\"id\":\"x_1\",\"object\":\"unknown_kind\"}";

        assertThatThrownBy(() -> codec.decode(json, StripeObject.class))
                .isInstanceOf(DecodeException.class)
                .hasCauseInstanceOf(UnknownVariantException.class)
                .satisfies(e -> {
                    UnknownVariantException cause = (UnknownVariantException) e.getCause();
                    assertThat(cause.getDiscriminator()).isEqualTo("unknown_kind");
                    assertThat(cause.getUnionType()).isEqualTo(StripeObject.class);
                });
    }

    @Test
    void missingDiscriminatorFailsWithUnknownVariant() {
        assertThatThrownBy(() -> codec.decode("{\"id\":\"x_1\"}", StripeObject.class))
                .isInstanceOf(DecodeException.class)
                .satisfies(e -> {
                    assertThat(((DecodeException) e).isUnknownVariant()).isTrue();
                    assertThat(((UnknownVariantException) e.getCause()).getDiscriminator()).isNull();
                });
    }

    @Test
    void paymentSourceRegistryRejectsResourcesThatAreNotSources() {
        String json = "{\"id\":\"ch_1\",\"object\":\"charge\",\"amount\":1,\"currency\":\"usd\",\"created\":1}";

        assertThatThrownBy(() -> codec.decode(json, PaymentSource.class))
                .isInstanceOf(DecodeException.class)
                .satisfies(e -> assertThat(((DecodeException) e).isUnknownVariant()).isTrue());
    }

    @Test
    void customerSourcesDecodeEachVariant() throws Exception {
        Customer customer = codec.decode(Fixtures.load("customer_with_sources.json"), Customer.class);

        ListEnvelope<PaymentSource> sources = customer.getSources();
        assertThat(sources.getUrl()).isEqualTo("/v1/customers/cus_9xYz/sources");
        assertThat(sources.isHasMore()).isFalse();
        assertThat(sources.getTotalCount()).contains(2L);
        assertThat(sources.getData()).hasSize(2);
        assertThat(sources.getData().get(0)).isInstanceOf(Card.class);
        assertThat(sources.getData().get(1)).isInstanceOf(BitcoinReceiver.class);
        BitcoinReceiver receiver = (BitcoinReceiver) sources.getData().get(1);
        assertThat(receiver.getBitcoinAmount()).isEqualTo(1757908L);
        assertThat(receiver.getCreated()).isEqualTo(Instant.ofEpochSecond(1699990100L));
    }

    @Test
    void unknownVariantNestedInListIsReportedNotSkipped() {
        String json = "{\"id\":\"cus_1\",\"created\":1,\"sources\":{\"url\":\"/v1/x\",\"has_more\":false,"
                + "\"data\":[{\"id\":\"ba_1\",\"object\":\"bank_account\"}]}}";

        assertThatThrownBy(() -> codec.decode(json, Customer.class))
                .isInstanceOf(DecodeException.class)
                .satisfies(e -> assertThat(((DecodeException) e).isUnknownVariant()).isTrue());
    }

    @Test
    void eventDataObjectDecodesThroughRegistry() throws Exception {
        Event event = codec.decode(Fixtures.load("event_customer_created.json"), Event.class);

        assertThat(event.getType()).isEqualTo("customer.created");
        assertThat(event.getData().getObject()).isInstanceOf(Customer.class);
        assertThat(event.getData().getObject().getId()).isEqualTo("cus_9xYz");
    }

    @Test
    void eventWithUnknownObjectFails() {
        assertThatThrownBy(() -> codec.decode(Fixtures.load("event_unknown_object.json"), Event.class))
                .isInstanceOf(DecodeException.class)
                .satisfies(e -> assertThat(((DecodeException) e).isUnknownVariant()).isTrue());
    }

    @Test
    void listFilterDecodesTimestampOrRange() throws Exception {
        ListFilterInput exact = codec.decode("1700000000", ListFilterInput.class);
        ListFilterInput range = codec.decode("{\"gt\":1600000000,\"lte\":1700000000}", ListFilterInput.class);

        assertThat(exact).isEqualTo(ListFilterInput.at(Instant.ofEpochSecond(1700000000L)));
        assertThat(range).isEqualTo(ListFilterInput.Range.builder()
                .gt(Instant.ofEpochSecond(1600000000L))
                .lte(Instant.ofEpochSecond(1700000000L))
                .build());
    }

    @Test
    void listEnvelopeRequiresHasMore() {
        String json = "{\"url\":\"/v1/charges\",\"data\":[]}";

        assertThatThrownBy(() -> codec.decode(json, new TypeReference<ListEnvelope<Charge>>() {}))
                .isInstanceOf(DecodeException.class);
    }

    @Test
    void registryRejectsDuplicateDiscriminators() {
        assertThatThrownBy(() -> DiscriminatorRegistry.builder(StripeObject.class)
                .variant("card", Card.class)
                .variant("card", BitcoinReceiver.class))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
