package com.flagship.gold_ledger.member;

/**
 * Closed set of roles an address can hold. The bit position is the persisted layout of
 * {@code address_roles.role_mask} and must never be reordered.
 */
public enum Role {
    REFINER(0),
    MINTER(1),
    CUSTODIAN(2),
    VAULT_OPERATOR(3),
    LOGISTICS_PROVIDER(4),
    AUDITOR(5),
    PLATFORM(6),
    GOVERNANCE(7);

    private final int bit;

    Role(int bit) {
        this.bit = bit;
    }

    public int bit() {
        return bit;
    }

    public int mask() {
        return 1 << bit;
    }
}
