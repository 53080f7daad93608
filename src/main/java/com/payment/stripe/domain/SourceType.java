package com.payment.stripe.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Balance a transfer draws from.
 */
public enum SourceType {
    @JsonProperty("card")
    CARD,
    @JsonProperty("alipay_account")
    ALIPAY_ACCOUNT,
    @JsonProperty("bitcoin_receiver")
    BITCOIN_RECEIVER,
    @JsonProperty("bank_account")
    BANK_ACCOUNT
}
