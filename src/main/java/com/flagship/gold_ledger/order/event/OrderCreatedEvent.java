package com.flagship.gold_ledger.order.event;

import com.flagship.gold_ledger.order.SettlementOrder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Full settlement instruction as prepared.
 */
@Value
public class OrderCreatedEvent implements OrderEvent {
    UUID eventId;
    String txRef;
    String externalRef;
    String orderType;
    String initiatorId;
    String counterpartyId;
    String sourceAccountId;
    String destAccountId;
    List<Long> tokenIds;
    List<String> requestedAssets;
    int quantity;
    LocalDate settlementDate;
    String currency;
    BigDecimal price;
    BigDecimal fee;
    String metadata;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderCreatedEvent fromOrder(SettlementOrder order) {
        return new OrderCreatedEvent(
            UUID.randomUUID(),
            order.getTxRef(),
            order.getExternalRef(),
            order.getType().name(),
            order.getInitiatorId(),
            order.getCounterpartyId(),
            order.getSourceAccountId(),
            order.getDestAccountId(),
            order.getTokenIds(),
            order.getRequestedAssets(),
            order.getQuantity(),
            order.getSettlementDate(),
            order.getCurrency() != null ? order.getCurrency().name() : null,
            order.getPrice(),
            order.getFee(),
            order.getMetadata(),
            Instant.now()
        );
    }
}
