package com.payment.stripe.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Cursor and page-size parameters shared by list endpoints.
 */
@Value
@Builder(toBuilder = true)
public class ListParams {

    public static final ListParams DEFAULT = ListParams.builder().build();

    /** Page size, 1 to 100. */
    Integer limit;
    String startingAfter;
    String endingBefore;

    /** Adds {@code include[]=total_count}; not a form field. */
    @JsonIgnore
    boolean includeTotalCount;

    /** Parameters for the page after {@code envelope}, or empty when there is none. */
    public <T extends StripeObject> Optional<ListParams> next(ListEnvelope<T> envelope) {
        if (!envelope.isHasMore()) {
            return Optional.empty();
        }
        return envelope.last().map(last -> toBuilder().startingAfter(last.getId()).endingBefore(null).build());
    }
}
