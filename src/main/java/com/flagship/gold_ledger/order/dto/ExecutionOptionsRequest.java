package com.flagship.gold_ledger.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ExecutionOptionsRequest {

    @JsonProperty("on_chain_transfer")
    boolean onChainTransfer;

    @JsonProperty("auto_ledger_update")
    boolean autoLedgerUpdate;
}
