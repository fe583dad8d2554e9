package com.flagship.gold_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of the append-only audit log.
 *
 * Every state change of an account, asset, order or registry member is written here in the
 * same transaction as the change itself, then relayed to Kafka by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g. "Asset"
    String aggregateId;        // token id, IGAN, txRef, member id or address
    String eventType;          // e.g. "AssetMinted"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // sequence assigned by database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
