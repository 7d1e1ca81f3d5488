package com.flagship.token_ledger.ledger;

import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * Entries written since the last {@link TokenLedger#drainChanges()}, with their current values.
 *
 * An allowance of zero means the entry was removed.
 */
@Value
public class LedgerChange {
    BigInteger totalSupply;
    Map<AccountId, BigInteger> balances;
    Map<AllowanceKey, BigInteger> allowances;

    public LedgerChange(BigInteger totalSupply,
                        Map<AccountId, BigInteger> balances,
                        Map<AllowanceKey, BigInteger> allowances) {
        this.totalSupply = totalSupply;
        this.balances = Map.copyOf(balances);
        this.allowances = Map.copyOf(allowances);
    }

    public boolean touchesNoEntries() {
        return balances.isEmpty() && allowances.isEmpty();
    }
}
