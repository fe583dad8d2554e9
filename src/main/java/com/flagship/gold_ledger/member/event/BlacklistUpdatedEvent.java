package com.flagship.gold_ledger.member.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class BlacklistUpdatedEvent implements RegistryEvent {
    UUID eventId;
    String address;
    boolean blacklisted;
    String reason;
    String updatedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BlacklistUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BlacklistUpdatedEvent of(String address, boolean blacklisted, String reason, String updatedBy) {
        return new BlacklistUpdatedEvent(
            UUID.randomUUID(), address, blacklisted, reason, updatedBy, Instant.now());
    }
}
