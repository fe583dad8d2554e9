package com.flagship.gold_ledger.ledger.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One balance change. {@code updatedBy} is the operator address, or the capability holder
 * for contract-driven updates; {@code channel} tells the two apart.
 */
@Value
public class BalanceUpdatedEvent implements LedgerEvent {
    UUID eventId;
    String accountId;
    long delta;
    long newBalance;
    String reason;
    String reference;
    String channel;
    String updatedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "BalanceUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static BalanceUpdatedEvent of(String accountId, long delta, long newBalance, String reason,
                                         String reference, String channel, String updatedBy) {
        return new BalanceUpdatedEvent(
            UUID.randomUUID(), accountId, delta, newBalance, reason, reference, channel, updatedBy, Instant.now());
    }
}
