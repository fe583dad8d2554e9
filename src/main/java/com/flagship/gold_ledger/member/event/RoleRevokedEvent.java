package com.flagship.gold_ledger.member.event;

import com.flagship.gold_ledger.member.RoleSet;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class RoleRevokedEvent implements RegistryEvent {
    UUID eventId;
    String address;
    String revoked;
    int roleMask;
    String revokedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RoleRevoked";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static RoleRevokedEvent of(String address, RoleSet revoked, RoleSet result, String revokedBy) {
        return new RoleRevokedEvent(
            UUID.randomUUID(), address, revoked.toString(), result.toMask(), revokedBy, Instant.now());
    }
}
