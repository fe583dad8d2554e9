package com.flagship.gold_ledger.order;

/**
 * Settlement order lifecycle.
 *
 * PENDING_COUNTERPARTY -> PENDING_EXECUTION -> EXECUTED, with CANCELLED and FAILED as
 * administrative exits from either pending state. No transition is ever reversed.
 */
public enum OrderStatus {
    PENDING_COUNTERPARTY,
    PENDING_EXECUTION,
    EXECUTED,
    CANCELLED,
    FAILED;

    public boolean isTerminal() {
        return this == EXECUTED || this == CANCELLED || this == FAILED;
    }
}
