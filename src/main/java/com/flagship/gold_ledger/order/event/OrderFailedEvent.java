package com.flagship.gold_ledger.order.event;

import com.flagship.gold_ledger.order.SettlementOrder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class OrderFailedEvent implements OrderEvent {
    UUID eventId;
    String txRef;
    String previousStatus;
    String reason;
    String failedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderFailedEvent fromOrder(SettlementOrder before, String reason, String failedBy) {
        return new OrderFailedEvent(UUID.randomUUID(), before.getTxRef(), before.getStatus().name(),
            reason, failedBy, Instant.now());
    }
}
