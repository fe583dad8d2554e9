package com.flagship.gold_ledger.order.event;

import com.flagship.gold_ledger.order.SettlementOrder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The order is waiting for the counterparty signature.
 */
@Value
public class OrderPreparedEvent implements OrderEvent {
    UUID eventId;
    String txRef;
    String status;
    String preparedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderPrepared";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderPreparedEvent fromOrder(SettlementOrder order, String preparedBy) {
        return new OrderPreparedEvent(UUID.randomUUID(), order.getTxRef(), order.getStatus().name(),
            preparedBy, Instant.now());
    }
}
