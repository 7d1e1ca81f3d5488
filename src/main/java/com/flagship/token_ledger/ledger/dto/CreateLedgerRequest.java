package com.flagship.token_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

import java.math.BigInteger;

/**
 * Request DTO for creating the ledger with an explicit initial supply.
 * Omitting the body altogether creates an empty ledger.
 */
@Value
public class CreateLedgerRequest {

    @NotNull(message = "Initial supply is required")
    @PositiveOrZero(message = "Initial supply must not be negative")
    @JsonProperty("initial_supply")
    BigInteger initialSupply;
}
