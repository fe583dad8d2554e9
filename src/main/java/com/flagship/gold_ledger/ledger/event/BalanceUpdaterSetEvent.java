package com.flagship.gold_ledger.ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class BalanceUpdaterSetEvent implements LedgerEvent {
    UUID eventId;
    String holder;
    boolean enabled;
    String updatedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceUpdaterSet";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BalanceUpdaterSetEvent of(String holder, boolean enabled, String updatedBy) {
        return new BalanceUpdaterSetEvent(UUID.randomUUID(), holder, enabled, updatedBy, Instant.now());
    }
}
