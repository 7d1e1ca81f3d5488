package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.AccountId;
import lombok.Value;

import java.math.BigInteger;

@Value
public class AllowanceResponse {

    @JsonProperty("owner")
    AccountId owner;

    @JsonProperty("spender")
    AccountId spender;

    @JsonProperty("allowance")
    BigInteger allowance;
}
