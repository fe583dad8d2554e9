package com.flagship.gold_ledger.member;

import lombok.EqualsAndHashCode;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable bitset of {@link Role}s.
 *
 * Combination ({@link #with}, {@link #union}) is bitwise OR, removal ({@link #without}) is
 * AND-NOT, and membership ({@link #contains}) tests a single bit. Bits outside the known
 * roles are rejected by {@link #fromMask} so a corrupt mask cannot grant unnamed rights.
 */
@EqualsAndHashCode
public final class RoleSet {

    private static final int VALID_BITS = validBits();
    private static final RoleSet EMPTY = new RoleSet(0);

    private final int mask;

    private RoleSet(int mask) {
        this.mask = mask;
    }

    public static RoleSet empty() {
        return EMPTY;
    }

    public static RoleSet of(Role... roles) {
        int mask = 0;
        for (Role role : roles) {
            mask |= role.mask();
        }
        return new RoleSet(mask);
    }

    public static RoleSet of(Collection<Role> roles) {
        return of(roles.toArray(new Role[0]));
    }

    public static RoleSet fromMask(int mask) {
        if ((mask & ~VALID_BITS) != 0) {
            throw new IllegalArgumentException("Role mask contains unknown bits: " + Integer.toBinaryString(mask));
        }
        return new RoleSet(mask);
    }

    public int toMask() {
        return mask;
    }

    public RoleSet with(Role role) {
        return new RoleSet(mask | role.mask());
    }

    public RoleSet without(Role role) {
        return new RoleSet(mask & ~role.mask());
    }

    public RoleSet union(RoleSet other) {
        return new RoleSet(mask | other.mask);
    }

    public RoleSet minus(RoleSet other) {
        return new RoleSet(mask & ~other.mask);
    }

    public boolean contains(Role role) {
        return (mask & role.mask()) != 0;
    }

    public boolean containsAny(Role... roles) {
        for (Role role : roles) {
            if (contains(role)) {
                return true;
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return mask == 0;
    }

    public Set<Role> toSet() {
        EnumSet<Role> roles = EnumSet.noneOf(Role.class);
        for (Role role : Role.values()) {
            if (contains(role)) {
                roles.add(role);
            }
        }
        return roles;
    }

    @Override
    public String toString() {
        return toSet().stream().map(Role::name).collect(Collectors.joining("|", "[", "]"));
    }

    private static int validBits() {
        int bits = 0;
        for (Role role : Role.values()) {
            bits |= role.mask();
        }
        return bits;
    }
}
