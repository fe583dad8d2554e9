package com.flagship.gold_ledger.asset.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for asset custody events.
 *
 * All asset events carry the token they are about, so the audit log of a single bar can be
 * read back in order from the outbox.
 */
public interface AssetEvent {

    /**
     * Unique identifier for this event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    long getTokenId();

    Instant getOccurredAt();

    String getEventType();
}
