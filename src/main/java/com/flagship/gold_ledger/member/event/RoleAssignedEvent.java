package com.flagship.gold_ledger.member.event;

import com.flagship.gold_ledger.member.RoleSet;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Roles granted to an address. {@code roleMask} is the full mask after the grant.
 */
@Value
public class RoleAssignedEvent implements RegistryEvent {
    UUID eventId;
    String address;
    String memberId;
    String granted;
    int roleMask;
    String assignedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "RoleAssigned";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static RoleAssignedEvent of(String address, String memberId, RoleSet granted, RoleSet result,
                                       String assignedBy) {
        return new RoleAssignedEvent(
            UUID.randomUUID(), address, memberId, granted.toString(), result.toMask(), assignedBy, Instant.now());
    }
}
