package com.flagship.gold_ledger.ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for account ledger events.
 */
public interface LedgerEvent {

    UUID getEventId();

    Instant getOccurredAt();

    String getEventType();
}
