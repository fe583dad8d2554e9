package com.flagship.gold_ledger.asset.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class CustodyChangedEvent implements AssetEvent {
    UUID eventId;
    long tokenId;
    String previousCustodian;
    String newCustodian;
    String method;
    String changedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CustodyChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CustodyChangedEvent of(long tokenId, String previousCustodian, String newCustodian,
                                         String method, String changedBy) {
        return new CustodyChangedEvent(UUID.randomUUID(), tokenId, previousCustodian, newCustodian,
            method, changedBy, Instant.now());
    }
}
