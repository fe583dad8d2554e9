package com.flagship.gold_ledger.order.event;

import com.flagship.gold_ledger.order.ExecutionOptions;
import com.flagship.gold_ledger.order.SettlementOrder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Settlement concluded. The two flags record which side effects ran; when either is false,
 * that movement is expected to be reconciled off-path.
 */
@Value
public class OrderExecutedEvent implements OrderEvent {
    UUID eventId;
    String txRef;
    String sourceAccountId;
    String destAccountId;
    List<Long> tokenIds;
    int quantity;
    String newOwner;
    boolean tokensTransferred;
    boolean ledgerUpdated;
    String executedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "OrderExecuted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static OrderExecutedEvent fromOrder(SettlementOrder order, String newOwner, ExecutionOptions options,
                                               String executedBy) {
        return new OrderExecutedEvent(
            UUID.randomUUID(),
            order.getTxRef(),
            order.getSourceAccountId(),
            order.getDestAccountId(),
            order.getTokenIds(),
            order.getQuantity(),
            newOwner,
            options.isOnChainTransfer(),
            options.isAutoLedgerUpdate(),
            executedBy,
            Instant.now()
        );
    }
}
