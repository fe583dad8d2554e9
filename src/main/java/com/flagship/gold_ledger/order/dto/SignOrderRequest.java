package com.flagship.gold_ledger.order.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Value;

@Value
public class SignOrderRequest {

    @NotBlank(message = "Signature is required")
    @Pattern(regexp = "^(0x)?([0-9a-fA-F]{2})+$", message = "Signature must be hex encoded")
    @JsonProperty("signature")
    String signature;

    @JsonProperty("party")
    String party;
}
