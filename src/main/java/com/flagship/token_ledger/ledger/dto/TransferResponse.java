package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.AccountId;
import lombok.Value;

import java.math.BigInteger;

/**
 * Echo of a completed movement of tokens.
 */
@Value
public class TransferResponse {

    @JsonProperty("from")
    AccountId from;

    @JsonProperty("to")
    AccountId to;

    @JsonProperty("value")
    BigInteger value;
}
