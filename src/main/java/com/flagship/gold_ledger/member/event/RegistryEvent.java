package com.flagship.gold_ledger.member.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Common shape of registry audit events.
 */
public interface RegistryEvent {

    UUID getEventId();

    Instant getOccurredAt();

    String getEventType();
}
