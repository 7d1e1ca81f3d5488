package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.token_ledger.ledger.AccountId;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request DTO for moving tokens out of another account to the caller.
 */
@Value
public class TransferFromRequest {

    @NotNull(message = "Source account is required")
    @JsonProperty("from")
    AccountId from;

    @NotNull(message = "Value is required")
    @PositiveOrZero(message = "Value must not be negative")
    @JsonProperty("value")
    BigInteger value;
}
