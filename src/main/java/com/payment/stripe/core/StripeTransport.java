package com.payment.stripe.core;

import com.payment.stripe.error.TransientServerError;

/**
 * Sends one HTTP request and returns whatever came back. A non-2xx status is a normal response
 * here; classifying it is the caller's job.
 */
public interface StripeTransport {

    /**
     * @throws TransientServerError if no response was received (connect failure, timeout, reset)
     */
    TransportResponse execute(TransportRequest request);
}
