package com.flagship.gold_ledger.exception;

import lombok.Getter;

/**
 * Base class for every domain failure raised by the custody, ledger and settlement services.
 *
 * Each failure carries a stable code so callers can surface the specific error kind
 * to the end user. All failures are terminal for the triggering call: the surrounding
 * transaction rolls back and nothing is retried.
 */
@Getter
public abstract class GoldLedgerException extends RuntimeException {

    private final String code;

    protected GoldLedgerException(String code, String message) {
        super(message);
        this.code = code;
    }
}
