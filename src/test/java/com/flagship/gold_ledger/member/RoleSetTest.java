package com.flagship.gold_ledger.member;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoleSetTest {

    @Test
    @DisplayName("Bit layout follows the declared role order")
    void testMaskLayout() {
        assertEquals(0b1, RoleSet.of(Role.REFINER).toMask());
        assertEquals(0b100, RoleSet.of(Role.CUSTODIAN).toMask());
        assertEquals(0b1100_0000, RoleSet.of(Role.PLATFORM, Role.GOVERNANCE).toMask());
        assertEquals(0, RoleSet.empty().toMask());
    }

    @Test
    @DisplayName("Combination is OR, removal is AND-NOT")
    void testCombineAndRemove() {
        RoleSet roles = RoleSet.of(Role.MINTER).with(Role.CUSTODIAN).union(RoleSet.of(Role.AUDITOR));

        assertTrue(roles.contains(Role.MINTER));
        assertTrue(roles.contains(Role.CUSTODIAN));
        assertTrue(roles.contains(Role.AUDITOR));
        assertFalse(roles.contains(Role.PLATFORM));

        RoleSet reduced = roles.without(Role.CUSTODIAN).minus(RoleSet.of(Role.AUDITOR, Role.GOVERNANCE));
        assertEquals(RoleSet.of(Role.MINTER), reduced);
        assertTrue(roles.contains(Role.CUSTODIAN), "Original set is not modified");
    }

    @Test
    @DisplayName("containsAny matches a single shared role")
    void testContainsAny() {
        RoleSet roles = RoleSet.of(Role.VAULT_OPERATOR);

        assertTrue(roles.containsAny(Role.CUSTODIAN, Role.VAULT_OPERATOR));
        assertFalse(roles.containsAny(Role.PLATFORM, Role.GOVERNANCE));
        assertFalse(roles.containsAny());
        assertFalse(RoleSet.empty().containsAny(Role.values()));
    }

    @Test
    @DisplayName("Unknown bits in a stored mask are rejected")
    void testFromMaskRejectsUnknownBits() {
        assertEquals(RoleSet.of(Role.REFINER, Role.GOVERNANCE), RoleSet.fromMask(0b1000_0001));
        assertThrows(IllegalArgumentException.class, () -> RoleSet.fromMask(1 << 8));
        assertThrows(IllegalArgumentException.class, () -> RoleSet.fromMask(-1));
    }

    @Test
    @DisplayName("Collection factory and set view agree")
    void testCollectionRoundTrip() {
        RoleSet roles = RoleSet.of(List.of(Role.PLATFORM, Role.REFINER, Role.PLATFORM));

        assertEquals(EnumSet.of(Role.REFINER, Role.PLATFORM), roles.toSet());
        assertEquals("[REFINER|PLATFORM]", roles.toString());
        assertTrue(RoleSet.of(List.of()).isEmpty());
    }
}
