package com.flagship.gold_ledger.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Reason for cancelling or failing a pending order.
 */
@Value
public class CloseOrderRequest {

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
