package com.flagship.gold_ledger.member.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class RegisterMemberRequest {

    @NotBlank(message = "Member ID is required")
    @Size(max = 64, message = "Member ID must be at most 64 characters")
    @JsonProperty("member_id")
    String memberId;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @Size(max = 8, message = "Country must be at most 8 characters")
    @JsonProperty("country")
    String country;
}
