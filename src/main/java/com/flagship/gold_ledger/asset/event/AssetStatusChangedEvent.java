package com.flagship.gold_ledger.asset.event;

import com.flagship.gold_ledger.asset.AssetStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AssetStatusChangedEvent implements AssetEvent {
    UUID eventId;
    long tokenId;
    String previousStatus;
    String newStatus;
    String reason;
    String changedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetStatusChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AssetStatusChangedEvent of(long tokenId, AssetStatus previous, AssetStatus next,
                                             String reason, String changedBy) {
        return new AssetStatusChangedEvent(UUID.randomUUID(), tokenId, previous.name(), next.name(),
            reason, changedBy, Instant.now());
    }
}
