package com.flagship.gold_ledger.member.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_ledger.member.MemberStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class UpdateMemberStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    MemberStatus status;
}
