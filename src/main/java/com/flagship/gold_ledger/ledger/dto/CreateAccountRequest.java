package com.flagship.gold_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CreateAccountRequest {

    @NotBlank(message = "Member ID is required")
    @JsonProperty("member_id")
    String memberId;

    @NotBlank(message = "Address is required")
    @JsonProperty("address")
    String address;
}
