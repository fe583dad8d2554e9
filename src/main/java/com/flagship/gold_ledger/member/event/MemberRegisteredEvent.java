package com.flagship.gold_ledger.member.event;

import com.flagship.gold_ledger.member.Member;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class MemberRegisteredEvent implements RegistryEvent {
    UUID eventId;
    String memberId;
    String name;
    String country;
    String status;
    String registeredBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "MemberRegistered";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MemberRegisteredEvent of(Member member, String registeredBy) {
        return new MemberRegisteredEvent(
            UUID.randomUUID(),
            member.getMemberId(),
            member.getName(),
            member.getCountry(),
            member.getStatus().name(),
            registeredBy,
            Instant.now()
        );
    }
}
