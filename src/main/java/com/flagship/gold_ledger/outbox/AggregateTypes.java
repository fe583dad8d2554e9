package com.flagship.gold_ledger.outbox;

import java.util.List;

/**
 * Aggregate type names used as the outbox partitioning key and for topic routing.
 */
public final class AggregateTypes {

    public static final String ASSET = "Asset";
    public static final String ACCOUNT = "Account";
    public static final String ORDER = "Order";
    public static final String MEMBER = "Member";

    public static final List<String> ALL = List.of(ASSET, ACCOUNT, ORDER, MEMBER);

    private AggregateTypes() {
    }

    public static boolean isKnown(String aggregateType) {
        return ALL.contains(aggregateType);
    }
}
