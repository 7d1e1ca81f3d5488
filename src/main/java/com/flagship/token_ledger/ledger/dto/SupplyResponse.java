package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigInteger;

@Value
public class SupplyResponse {

    @JsonProperty("total_supply")
    BigInteger totalSupply;
}
