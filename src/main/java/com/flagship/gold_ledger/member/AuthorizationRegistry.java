package com.flagship.gold_ledger.member;

import com.flagship.gold_ledger.exception.AuthorizationException;
import com.flagship.gold_ledger.exception.ComplianceException;

import java.util.Optional;

/**
 * Read-only view of member identity, roles and compliance status consulted by the
 * ledger, custody and settlement services. None of them ever mutate it.
 */
public interface AuthorizationRegistry {

    /**
     * Roles granted to an address; empty for unknown addresses.
     */
    RoleSet getRoles(String address);

    /**
     * @throws com.flagship.gold_ledger.exception.NotFoundException if the member is unknown
     */
    MemberStatus getMemberStatus(String memberId);

    /**
     * Status of a member, or empty if no such member is registered.
     */
    Optional<MemberStatus> findMemberStatus(String memberId);

    boolean isBlacklisted(String address);

    default boolean isInRole(String address, Role role) {
        return getRoles(address).contains(role);
    }

    default boolean hasAnyRole(String address, Role... roles) {
        return getRoles(address).containsAny(roles);
    }

    default void requireAnyRole(String caller, Role... roles) {
        if (caller == null || !hasAnyRole(caller, roles)) {
            throw AuthorizationException.missingRole(caller, roles);
        }
    }

    default void requireNotBlacklisted(String... addresses) {
        for (String address : addresses) {
            if (isBlacklisted(address)) {
                throw new ComplianceException(address);
            }
        }
    }
}
