package com.flagship.gold_ledger.order.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for settlement order events.
 *
 * All order events share these common properties:
 * - Event ID for deduplication
 * - Transaction reference (aggregate ID)
 * - Timestamp of when the event occurred
 */
public interface OrderEvent {

    UUID getEventId();

    String getTxRef();

    Instant getOccurredAt();

    String getEventType();
}
