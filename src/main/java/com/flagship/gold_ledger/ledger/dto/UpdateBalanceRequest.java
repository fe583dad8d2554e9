package com.flagship.gold_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Operator balance correction. A negative delta is a debit.
 */
@Value
public class UpdateBalanceRequest {

    @NotNull(message = "Delta is required")
    @JsonProperty("delta")
    Long delta;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("reference_id")
    String referenceId;
}
