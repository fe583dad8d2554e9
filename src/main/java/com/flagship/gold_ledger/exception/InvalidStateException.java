package com.flagship.gold_ledger.exception;

/**
 * Raised on custody lock violations and on state machine transitions from the wrong phase.
 */
public class InvalidStateException extends GoldLedgerException {

    public static final String ASSET_LOCKED = "ASSET_LOCKED";
    public static final String ASSET_BURNED = "ASSET_BURNED";
    public static final String INVALID_ORDER_STATE = "INVALID_ORDER_STATE";

    public InvalidStateException(String code, String message) {
        super(code, message);
    }
}
