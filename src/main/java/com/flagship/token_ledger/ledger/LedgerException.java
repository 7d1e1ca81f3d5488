package com.flagship.token_ledger.ledger;

/**
 * Base type for business-rule failures raised by the ledger.
 * A ledger operation that throws one of these has not mutated any state.
 */
public abstract class LedgerException extends RuntimeException {

    protected LedgerException(String message) {
        super(message);
    }
}
