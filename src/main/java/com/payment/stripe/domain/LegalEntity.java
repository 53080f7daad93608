package com.payment.stripe.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Identity details of the person or company behind an account. Sent as nested form fields,
 * e.g. {@code legal_entity[address][city]}.
 */
@Value
@Builder
@Jacksonized
public class LegalEntity {

    /** {@code individual} or {@code company}. */
    String type;
    String firstName;
    String lastName;
    String businessName;
    Address address;
    DateOfBirth dob;

    @Value
    @Builder
    @Jacksonized
    public static class Address {
        String line1;
        String line2;
        String city;
        String state;
        String postalCode;
        String country;
    }

    @Value
    @Builder
    @Jacksonized
    public static class DateOfBirth {
        Integer day;
        Integer month;
        Integer year;
    }
}
