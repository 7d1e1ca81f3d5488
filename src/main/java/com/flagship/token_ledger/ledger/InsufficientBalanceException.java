package com.flagship.token_ledger.ledger;

import lombok.Getter;

import java.math.BigInteger;

/**
 * Raised when a debit's source account holds less than the requested amount.
 */
@Getter
public class InsufficientBalanceException extends LedgerException {

    private final AccountId account;
    private final BigInteger balance;
    private final BigInteger requested;

    public InsufficientBalanceException(AccountId account, BigInteger balance, BigInteger requested) {
        super(String.format("Insufficient balance: account=%s, balance=%s, requested=%s",
            account, balance, requested));
        this.account = account;
        this.balance = balance;
        this.requested = requested;
    }
}
