package com.flagship.gold_ledger.order;

import lombok.Value;

import java.time.Instant;

/**
 * Side effects performed by order execution. With both disabled, execution only records
 * the settled status and token/balance movement is reconciled off-path.
 */
@Value
public class ExecutionOptions {
    boolean onChainTransfer;
    boolean autoLedgerUpdate;
    String updatedBy;
    Instant updatedAt;
}
