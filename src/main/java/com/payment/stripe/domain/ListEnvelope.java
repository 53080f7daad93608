package com.payment.stripe.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

/**
 * One page of a Stripe list endpoint. Immutable; {@code url} and {@code hasMore} tell the caller
 * whether to ask for the next page with {@code starting_after}/{@code ending_before}.
 *
 * @param <T> element type
 */
@EqualsAndHashCode
@ToString
public final class ListEnvelope<T> {

    private final String url;
    private final boolean hasMore;
    private final List<T> data;
    private final Long totalCount;

    @JsonCreator
    public ListEnvelope(@JsonProperty(value = "url", required = true) String url,
                        @JsonProperty(value = "has_more", required = true) boolean hasMore,
                        @JsonProperty(value = "data", required = true) List<T> data,
                        @JsonProperty("total_count") Long totalCount) {
        if (url == null || data == null) {
            throw new IllegalArgumentException("List envelope requires url and data");
        }
        this.url = url;
        this.hasMore = hasMore;
        this.data = List.copyOf(data);
        this.totalCount = totalCount;
    }

    public String getUrl() {
        return url;
    }

    public boolean isHasMore() {
        return hasMore;
    }

    public List<T> getData() {
        return data;
    }

    /** Present only when the list was requested with {@code include[]=total_count}. */
    public Optional<Long> getTotalCount() {
        return Optional.ofNullable(totalCount);
    }

    /** Last element of the page; its id is the {@code starting_after} cursor for the next page. */
    public Optional<T> last() {
        return data.isEmpty() ? Optional.empty() : Optional.of(data.get(data.size() - 1));
    }
}
