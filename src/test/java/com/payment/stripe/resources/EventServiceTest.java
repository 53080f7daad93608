package com.payment.stripe.resources;

import com.payment.stripe.Fixtures;
import com.payment.stripe.core.TransportRequest;
import com.payment.stripe.domain.Customer;
import com.payment.stripe.domain.Event;
import com.payment.stripe.error.FatalProtocolError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class EventServiceTest extends StripeResourceTestSupport {

    private EventService events;

    @BeforeEach
    void setUp() {
        events = new EventService(executor, retries, VALIDATOR);
    }

    @Test
    void eventPayloadDecodesToConcreteResource() {
        respond(200, Fixtures.load("event_customer_created.json"));

        Event event = events.get("evt_3Kd").join();

        assertThat(event.getData().getObject()).isInstanceOf(Customer.class);
        assertThat(((Customer) event.getData().getObject()).getEmail()).isEqualTo("jenny@example.com");
    }

    @Test
    void unknownPayloadIsFatalAndNotRetried() {
        respond(200, Fixtures.load("event_unknown_object.json"));

        assertThatThrownBy(events.get("evt_9Zz")::join).hasCauseInstanceOf(FatalProtocolError.class);
        verify(transport, times(1)).execute(any(TransportRequest.class));
    }
}
