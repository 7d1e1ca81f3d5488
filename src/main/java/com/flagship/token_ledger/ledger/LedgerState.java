package com.flagship.token_ledger.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * Immutable snapshot of everything a {@link TokenLedger} owns.
 * This is what the host persists between calls and restores on startup.
 */
@Value
public class LedgerState {
    BigInteger totalSupply;
    Map<AccountId, BigInteger> balances;
    Map<AllowanceKey, BigInteger> allowances;

    public LedgerState(BigInteger totalSupply,
                       Map<AccountId, BigInteger> balances,
                       Map<AllowanceKey, BigInteger> allowances) {
        this.totalSupply = totalSupply;
        this.balances = Map.copyOf(balances);
        this.allowances = Map.copyOf(allowances);
    }
}
