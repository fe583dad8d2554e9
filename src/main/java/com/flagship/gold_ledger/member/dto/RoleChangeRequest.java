package com.flagship.gold_ledger.member.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_ledger.member.Role;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

/**
 * Grants or revokes roles on an address. {@code member_id} is only used when granting.
 */
@Value
public class RoleChangeRequest {

    @NotBlank(message = "Address is required")
    @JsonProperty("address")
    String address;

    @JsonProperty("member_id")
    String memberId;

    @NotEmpty(message = "At least one role is required")
    @JsonProperty("roles")
    List<Role> roles;
}
