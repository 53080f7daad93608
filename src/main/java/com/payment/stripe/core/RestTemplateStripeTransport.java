package com.payment.stripe.core;

import com.payment.stripe.error.TransientServerError;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.List;

/**
 * {@link StripeTransport} on top of a {@link RestTemplate}. Error statuses are returned as
 * responses; only I/O failures are translated, into {@link TransientServerError}.
 * The template's error handler is replaced, so do not share it with code that expects
 * {@code HttpClientErrorException}.
 */
public class RestTemplateStripeTransport implements StripeTransport {

    private final RestTemplate restTemplate;

    public RestTemplateStripeTransport(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
        this.restTemplate.setErrorHandler(new PassThroughErrorHandler());
    }

    @Override
    public TransportResponse execute(TransportRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        request.getHeaders().forEach(headers::set);

        HttpEntity<?> entity;
        if (request.getForm() != null) {
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
            MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
            request.getForm().forEach(form::add);
            entity = new HttpEntity<>(form, headers);
        } else {
            entity = new HttpEntity<>(headers);
        }

        try {
            ResponseEntity<String> response = restTemplate.exchange(request.getUri(), request.getMethod(), entity, String.class);
            return new TransportResponse(response.getStatusCode().value(), response.getBody());
        } catch (ResourceAccessException e) {
            throw TransientServerError.connectionFailure(request.getUri(), e);
        }
    }

    static class PassThroughErrorHandler implements ResponseErrorHandler {

        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
            // hasError is always false
        }
    }
}
