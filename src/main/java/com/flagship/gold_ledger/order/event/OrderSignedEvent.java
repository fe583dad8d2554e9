package com.flagship.gold_ledger.order.event;

import com.flagship.gold_ledger.order.SettlementOrder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class OrderSignedEvent implements OrderEvent {
    UUID eventId;
    String txRef;
    String signerAddress;
    String signerParty;
    String signature;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderSigned";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderSignedEvent fromOrder(SettlementOrder order) {
        return new OrderSignedEvent(UUID.randomUUID(), order.getTxRef(), order.getSignerAddress(),
            order.getSignerParty(), order.getSignature(), Instant.now());
    }
}
