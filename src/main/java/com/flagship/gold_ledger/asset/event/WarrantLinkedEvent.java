package com.flagship.gold_ledger.asset.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class WarrantLinkedEvent implements AssetEvent {
    UUID eventId;
    long tokenId;
    String warrantId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "WarrantLinked";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static WarrantLinkedEvent of(long tokenId, String warrantId) {
        return new WarrantLinkedEvent(UUID.randomUUID(), tokenId, warrantId, Instant.now());
    }
}
