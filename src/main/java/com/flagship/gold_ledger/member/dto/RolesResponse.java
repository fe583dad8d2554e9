package com.flagship.gold_ledger.member.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_ledger.member.Role;
import com.flagship.gold_ledger.member.RoleSet;
import lombok.Value;

import java.util.Set;

@Value
public class RolesResponse {

    @JsonProperty("address")
    String address;

    @JsonProperty("roles")
    Set<Role> roles;

    @JsonProperty("role_mask")
    int roleMask;

    @JsonProperty("blacklisted")
    boolean blacklisted;

    public static RolesResponse of(String address, RoleSet roles, boolean blacklisted) {
        return new RolesResponse(address, roles.toSet(), roles.toMask(), blacklisted);
    }
}
