package com.payment.stripe.resources;

import com.payment.stripe.Fixtures;
import com.payment.stripe.core.TransportRequest;
import com.payment.stripe.domain.Card;
import com.payment.stripe.domain.Customer;
import com.payment.stripe.domain.CustomerInput;
import com.payment.stripe.domain.CustomerListInput;
import com.payment.stripe.domain.DeleteResponse;
import com.payment.stripe.domain.ListParams;
import com.payment.stripe.error.InvalidInputException;
import com.payment.stripe.error.TypedError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class CustomerServiceTest extends StripeResourceTestSupport {

    private CustomerService customers;

    @BeforeEach
    void setUp() {
        customers = new CustomerService(executor, retries, VALIDATOR);
    }

    @Test
    void createEncodesMetadataAndDecodesSources() {
        respond(200, Fixtures.load("customer_with_sources.json"));

        Customer customer = customers.create(CustomerInput.builder()
                .email("jenny@example.com")
                .metadata(Map.of("crm_id", "42"))
                .build()).join();

        TransportRequest request = sentRequest();
        assertThat(request.getForm()).containsEntry("metadata[crm_id]", "42");
        assertThat(idempotencyKeyOf(request)).isNotBlank();
        assertThat(customer.getSources().getData().get(0)).isInstanceOf(Card.class);
    }

    @Test
    void invalidEmailIsRejectedLocally() {
        assertThatThrownBy(customers.create(CustomerInput.builder().email("not-an-email").build())::join)
                .hasCauseInstanceOf(InvalidInputException.class);
        verifyNoInteractions(transport);
    }

    @Test
    void deleteSendsDeleteWithIdempotencyKey() {
        respond(200, Fixtures.load("customer_deleted.json"));

        DeleteResponse response = customers.delete("cus_9xYz").join();

        assertThat(response.getDeleted()).isTrue();
        TransportRequest request = sentRequest();
        assertThat(request.getMethod()).isEqualTo(HttpMethod.DELETE);
        assertThat(idempotencyKeyOf(request)).isNotBlank();
    }

    @Test
    void getMissingCustomerSurfacesNotFound() {
        respond(404, Fixtures.error("invalid_request_error", null, "No such customer: cus_x"));

        assertThatThrownBy(customers.get("cus_x")::join).hasCauseInstanceOf(TypedError.NotFound.class);
        verify(transport, times(1)).execute(any(TransportRequest.class));
    }

    @Test
    void listPassesCursor() {
        respond(200, "{\"url\":\"/v1/customers\",\"has_more\":false,\"total_count\":0,\"data\":[]}");

        customers.list(CustomerListInput.builder()
                .page(ListParams.builder().endingBefore("cus_100").build())
                .build()).join();

        assertThat(sentRequest().getUri().getRawQuery()).isEqualTo("ending_before=cus_100");
    }
}
