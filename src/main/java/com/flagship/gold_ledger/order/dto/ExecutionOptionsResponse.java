package com.flagship.gold_ledger.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_ledger.order.ExecutionOptions;
import lombok.Value;

import java.time.Instant;

@Value
public class ExecutionOptionsResponse {

    @JsonProperty("on_chain_transfer")
    boolean onChainTransfer;

    @JsonProperty("auto_ledger_update")
    boolean autoLedgerUpdate;

    @JsonProperty("updated_by")
    String updatedBy;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ExecutionOptionsResponse from(ExecutionOptions options) {
        return new ExecutionOptionsResponse(options.isOnChainTransfer(), options.isAutoLedgerUpdate(),
            options.getUpdatedBy(), options.getUpdatedAt());
    }
}
