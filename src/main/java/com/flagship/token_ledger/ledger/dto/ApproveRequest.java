package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.AccountId;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

@Value
public class ApproveRequest {

    @NotNull(message = "Spender is required")
    @JsonProperty("spender")
    AccountId spender;

    @NotNull(message = "Value is required")
    @PositiveOrZero(message = "Value must not be negative")
    @JsonProperty("value")
    BigInteger value;
}
