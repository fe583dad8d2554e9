package com.flagship.gold_ledger.asset;

/**
 * Custody status of a gold-bar token.
 *
 * IN_TRANSIT and PLEDGED are custody locks: ordinary transfers are refused while the bar
 * is moving between custodians or encumbered. BURNED is terminal.
 */
public enum AssetStatus {
    REGISTERED,
    IN_VAULT,
    IN_TRANSIT,
    PLEDGED,
    BURNED;

    public boolean isLocked() {
        return this == IN_TRANSIT || this == PLEDGED;
    }

    public boolean isTerminal() {
        return this == BURNED;
    }
}
