package com.flagship.gold_ledger.asset.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AssetTransferredEvent implements AssetEvent {
    UUID eventId;
    long tokenId;
    String from;
    String to;
    long quantity;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetTransferred";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AssetTransferredEvent of(long tokenId, String from, String to, long quantity) {
        return new AssetTransferredEvent(UUID.randomUUID(), tokenId, from, to, quantity, Instant.now());
    }
}
