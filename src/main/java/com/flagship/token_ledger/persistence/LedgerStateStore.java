package com.flagship.token_ledger.persistence;

import com.flagship.token_ledger.ledger.LedgerChange;
import com.flagship.token_ledger.ledger.LedgerState;

import java.util.Optional;

/**
 * Durable home of the ledger between calls.
 *
 * The host loads once before the first call and saves the entries each successful
 * mutation touched.
 */
public interface LedgerStateStore {

    /**
     * @return the stored state, or empty if no ledger has been created yet
     */
    Optional<LedgerState> load();

    /**
     * Writes the total supply and every entry in {@code change}; entries not named are left
     * as stored. A zero allowance deletes the stored allowance. Either all of it is written
     * or none of it.
     */
    void save(LedgerChange change);
}
