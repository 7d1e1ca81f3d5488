package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.AccountId;
import lombok.Value;

import java.math.BigInteger;

@Value
public class BalanceResponse {

    @JsonProperty("account")
    AccountId account;

    @JsonProperty("balance")
    BigInteger balance;
}
