package com.flagship.gold_ledger.order.event;

import com.flagship.gold_ledger.order.SettlementOrder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class OrderCancelledEvent implements OrderEvent {
    UUID eventId;
    String txRef;
    String previousStatus;
    String reason;
    String cancelledBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderCancelledEvent fromOrder(SettlementOrder before, String reason, String cancelledBy) {
        return new OrderCancelledEvent(UUID.randomUUID(), before.getTxRef(), before.getStatus().name(),
            reason, cancelledBy, Instant.now());
    }
}
