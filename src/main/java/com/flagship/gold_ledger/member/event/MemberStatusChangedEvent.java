package com.flagship.gold_ledger.member.event;

import com.flagship.gold_ledger.member.MemberStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class MemberStatusChangedEvent implements RegistryEvent {
    UUID eventId;
    String memberId;
    String previousStatus;
    String newStatus;
    String changedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "MemberStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MemberStatusChangedEvent of(String memberId, MemberStatus previous, MemberStatus next,
                                              String changedBy) {
        return new MemberStatusChangedEvent(
            UUID.randomUUID(), memberId, previous.name(), next.name(), changedBy, Instant.now());
    }
}
