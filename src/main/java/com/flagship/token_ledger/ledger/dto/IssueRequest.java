package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.AccountId;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

@Value
public class IssueRequest {

    @NotNull(message = "Receiver is required")
    @JsonProperty("to")
    AccountId to;

    @NotNull(message = "Value is required")
    @PositiveOrZero(message = "Value must not be negative")
    @JsonProperty("value")
    BigInteger value;
}
