package com.flagship.gold_ledger.ledger;

import java.util.UUID;

/**
 * Credential that lets a component move balances without an operator role.
 *
 * Instances can only be created by {@link AccountLedgerService} and are handed to the asset
 * custody and order settlement services when the application context is wired. The ledger
 * honours a capability only if it issued that exact instance and its holder is enabled.
 */
public final class LedgerWriteCapability {

    public static final String ASSET_CUSTODY = "asset-custody";
    public static final String ORDER_SETTLEMENT = "order-settlement";

    private final String holder;
    private final UUID id;

    LedgerWriteCapability(String holder) {
        this.holder = holder;
        this.id = UUID.randomUUID();
    }

    public String getHolder() {
        return holder;
    }

    @Override
    public String toString() {
        return "LedgerWriteCapability[" + holder + "/" + id.toString().substring(0, 8) + "]";
    }
}
