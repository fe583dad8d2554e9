package com.flagship.gold_ledger.asset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class TransferAssetRequest {

    @NotBlank(message = "From address is required")
    @JsonProperty("from")
    String from;

    @NotBlank(message = "To address is required")
    @JsonProperty("to")
    String to;

    @JsonProperty("quantity")
    Long quantity;

    /**
     * Only used by forced transfers.
     */
    @JsonProperty("reason")
    String reason;
}
