package com.payment.stripe.resources;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Entry point grouping the resource services that share one context, transport and retry policy.
 */
@Getter
@RequiredArgsConstructor
public class StripeClient {

    private final ChargeService charges;
    private final CustomerService customers;
    private final TransferService transfers;
    private final AccountService accounts;
    private final EventService events;
}
