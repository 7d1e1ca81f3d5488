package com.flagship.token_ledger.ledger;

import lombok.Getter;

import java.math.BigInteger;

/**
 * Raised when a credit would push a balance past {@link TokenLedger#MAX_BALANCE}.
 */
@Getter
public class BalanceOverflowException extends LedgerException {

    private final AccountId account;
    private final BigInteger balance;
    private final BigInteger credit;

    public BalanceOverflowException(AccountId account, BigInteger balance, BigInteger credit) {
        super(String.format("Balance overflow: account=%s, balance=%s, credit=%s",
            account, balance, credit));
        this.account = account;
        this.balance = balance;
        this.credit = credit;
    }
}
