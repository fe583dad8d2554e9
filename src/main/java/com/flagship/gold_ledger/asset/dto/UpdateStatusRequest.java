package com.flagship.gold_ledger.asset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_ledger.asset.AssetStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class UpdateStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    AssetStatus status;

    @JsonProperty("reason")
    String reason;
}
