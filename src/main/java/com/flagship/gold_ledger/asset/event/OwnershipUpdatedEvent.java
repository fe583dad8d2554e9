package com.flagship.gold_ledger.asset.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Owner of record moved. {@code tag} is TRANSFER, SETTLEMENT or the reason of a forced transfer.
 */
@Value
public class OwnershipUpdatedEvent implements AssetEvent {
    UUID eventId;
    long tokenId;
    String previousOwner;
    String newOwner;
    String tag;
    String reference;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OwnershipUpdated";
    public static final String TAG_TRANSFER = "TRANSFER";
    public static final String TAG_SETTLEMENT = "SETTLEMENT";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OwnershipUpdatedEvent of(long tokenId, String previousOwner, String newOwner,
                                           String tag, String reference) {
        return new OwnershipUpdatedEvent(UUID.randomUUID(), tokenId, previousOwner, newOwner, tag,
            reference, Instant.now());
    }
}
