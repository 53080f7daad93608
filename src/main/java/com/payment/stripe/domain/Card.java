package com.payment.stripe.domain;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Card implements PaymentSource {

    @NonNull
    String id;
    String brand;
    String last4;
    Integer expMonth;
    Integer expYear;
    String country;
    String funding;
    String customer;
    String name;

    @Override
    public String toString() {
        return "Card(id=" + id + ", brand=" + brand + ", expMonth=" + expMonth + ", expYear=" + expYear + ")";
    }
}
