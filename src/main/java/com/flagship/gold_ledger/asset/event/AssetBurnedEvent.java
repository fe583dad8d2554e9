package com.flagship.gold_ledger.asset.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * {@code debitedAccountId} is the mint-time account; {@code requestedAccountId} is whatever
 * the caller passed to burn and is recorded for audit only.
 */
@Value
public class AssetBurnedEvent implements AssetEvent {
    UUID eventId;
    long tokenId;
    String debitedAccountId;
    String requestedAccountId;
    String reason;
    String burnedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetBurned";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AssetBurnedEvent of(long tokenId, String debitedAccountId, String requestedAccountId,
                                      String reason, String burnedBy) {
        return new AssetBurnedEvent(UUID.randomUUID(), tokenId, debitedAccountId, requestedAccountId,
            reason, burnedBy, Instant.now());
    }
}
