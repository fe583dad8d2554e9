package com.flagship.gold_ledger.exception;

import lombok.Getter;

/**
 * Raised when applying a delta would drive an account balance below zero.
 */
@Getter
public class InsufficientBalanceException extends GoldLedgerException {

    public static final String INSUFFICIENT_BALANCE = "INSUFFICIENT_BALANCE";

    private final String accountId;
    private final long balance;
    private final long delta;

    public InsufficientBalanceException(String accountId, long balance, long delta) {
        super(INSUFFICIENT_BALANCE,
            String.format("Account %s has balance %d, cannot apply delta %d", accountId, balance, delta));
        this.accountId = accountId;
        this.balance = balance;
        this.delta = delta;
    }
}
