package com.flagship.gold_ledger.member.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class BlacklistRequest {

    @NotBlank(message = "Address is required")
    @JsonProperty("address")
    String address;

    @JsonProperty("blacklisted")
    boolean blacklisted;

    @JsonProperty("reason")
    String reason;
}
