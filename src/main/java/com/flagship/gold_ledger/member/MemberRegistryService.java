package com.flagship.gold_ledger.member;

import com.flagship.gold_ledger.exception.DuplicateException;
import com.flagship.gold_ledger.exception.NotFoundException;
import com.flagship.gold_ledger.member.event.BlacklistUpdatedEvent;
import com.flagship.gold_ledger.member.event.MemberRegisteredEvent;
import com.flagship.gold_ledger.member.event.MemberStatusChangedEvent;
import com.flagship.gold_ledger.member.event.RoleAssignedEvent;
import com.flagship.gold_ledger.member.event.RoleRevokedEvent;
import com.flagship.gold_ledger.outbox.AggregateTypes;
import com.flagship.gold_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * JDBC-backed authorization registry.
 *
 * The custody core only reads it through {@link AuthorizationRegistry}. The mutating
 * operations populate it and require GOVERNANCE or PLATFORM.
 */
@Service
@Slf4j
public class MemberRegistryService implements AuthorizationRegistry {

    private static final Role[] REGISTRY_ADMIN_ROLES = {Role.GOVERNANCE, Role.PLATFORM};

    private final JdbcTemplate jdbcTemplate;
    private final OutboxService outboxService;

    public MemberRegistryService(JdbcTemplate jdbcTemplate, OutboxService outboxService) {
        this.jdbcTemplate = jdbcTemplate;
        this.outboxService = outboxService;
    }

    /**
     * Registers a member in PENDING status. Accounts can only be opened once it is ACTIVE.
     */
    @Transactional
    public Member registerMember(String caller, String memberId, String name, String country) {
        requireAnyRole(caller, REGISTRY_ADMIN_ROLES);
        if (memberId == null || memberId.isBlank()) {
            throw new IllegalArgumentException("Member id is required");
        }
        if (findMember(memberId).isPresent()) {
            throw DuplicateException.member(memberId);
        }

        jdbcTemplate.update(
            "INSERT INTO members (member_id, name, country, status, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            memberId, name, country, MemberStatus.PENDING.name()
        );
        Member member = getMember(memberId);

        outboxService.saveEvent(AggregateTypes.MEMBER, memberId,
            MemberRegisteredEvent.EVENT_TYPE, MemberRegisteredEvent.of(member, caller));

        log.info("Member registered: memberId={}, by={}", memberId, caller);
        return member;
    }

    @Transactional
    public Member updateMemberStatus(String caller, String memberId, MemberStatus status) {
        requireAnyRole(caller, REGISTRY_ADMIN_ROLES);
        MemberStatus previous = getMemberStatus(memberId);

        jdbcTemplate.update(
            "UPDATE members SET status = ?, updated_at = CURRENT_TIMESTAMP WHERE member_id = ?",
            status.name(), memberId
        );

        outboxService.saveEvent(AggregateTypes.MEMBER, memberId,
            MemberStatusChangedEvent.EVENT_TYPE, MemberStatusChangedEvent.of(memberId, previous, status, caller));

        log.info("Member status changed: memberId={}, {} -> {}", memberId, previous, status);
        return getMember(memberId);
    }

    /**
     * Adds roles to an address. The address may be linked to a member; an existing link is
     * kept when {@code memberId} is null.
     */
    @Transactional
    public RoleSet assignRoles(String caller, String address, String memberId, RoleSet roles) {
        requireAnyRole(caller, REGISTRY_ADMIN_ROLES);
        if (memberId != null && findMember(memberId).isEmpty()) {
            throw NotFoundException.member(memberId);
        }
        return grant(address, memberId, roles, caller);
    }

    @Transactional
    public RoleSet revokeRoles(String caller, String address, RoleSet roles) {
        requireAnyRole(caller, REGISTRY_ADMIN_ROLES);

        RoleSet result = getRoles(address).minus(roles);
        jdbcTemplate.update(
            "UPDATE address_roles SET role_mask = ?, updated_at = CURRENT_TIMESTAMP WHERE address = ?",
            result.toMask(), address
        );

        outboxService.saveEvent(AggregateTypes.MEMBER, address,
            RoleRevokedEvent.EVENT_TYPE, RoleRevokedEvent.of(address, roles, result, caller));

        log.info("Roles revoked: address={}, revoked={}, remaining={}", address, roles, result);
        return result;
    }

    @Transactional
    public void setBlacklisted(String caller, String address, boolean blacklisted, String reason) {
        requireAnyRole(caller, REGISTRY_ADMIN_ROLES);

        if (blacklisted) {
            jdbcTemplate.update(
                "INSERT INTO blacklisted_addresses (address, reason, created_at) VALUES (?, ?, CURRENT_TIMESTAMP) " +
                "ON CONFLICT (address) DO UPDATE SET reason = EXCLUDED.reason",
                address, reason
            );
        } else {
            jdbcTemplate.update("DELETE FROM blacklisted_addresses WHERE address = ?", address);
        }

        outboxService.saveEvent(AggregateTypes.MEMBER, address,
            BlacklistUpdatedEvent.EVENT_TYPE, BlacklistUpdatedEvent.of(address, blacklisted, reason, caller));

        log.info("Blacklist updated: address={}, blacklisted={}, by={}", address, blacklisted, caller);
    }

    /**
     * Grants roles without a caller check. Only used to seed the first administrator at startup.
     */
    @Transactional
    RoleSet grantBootstrapRoles(String address, RoleSet roles) {
        return grant(address, null, roles, "bootstrap");
    }

    @Override
    @Transactional(readOnly = true)
    public RoleSet getRoles(String address) {
        if (address == null) {
            return RoleSet.empty();
        }
        List<Integer> masks = jdbcTemplate.queryForList(
            "SELECT role_mask FROM address_roles WHERE address = ?", Integer.class, address);
        return masks.isEmpty() ? RoleSet.empty() : RoleSet.fromMask(masks.get(0));
    }

    @Override
    @Transactional(readOnly = true)
    public MemberStatus getMemberStatus(String memberId) {
        return getMember(memberId).getStatus();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<MemberStatus> findMemberStatus(String memberId) {
        return findMember(memberId).map(Member::getStatus);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isBlacklisted(String address) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM blacklisted_addresses WHERE address = ?", Integer.class, address);
        return count != null && count > 0;
    }

    @Transactional(readOnly = true)
    public Member getMember(String memberId) {
        return findMember(memberId).orElseThrow(() -> NotFoundException.member(memberId));
    }

    @Transactional(readOnly = true)
    public Optional<Member> findMember(String memberId) {
        return jdbcTemplate.query(
            "SELECT member_id, name, country, status, created_at, updated_at FROM members WHERE member_id = ?",
            memberRowMapper(), memberId
        ).stream().findFirst();
    }

    private RoleSet grant(String address, String memberId, RoleSet roles, String grantedBy) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Address is required");
        }
        RoleSet result = getRoles(address).union(roles);
        jdbcTemplate.update(
            "INSERT INTO address_roles (address, member_id, role_mask, updated_at) VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (address) DO UPDATE SET role_mask = EXCLUDED.role_mask, " +
            "member_id = COALESCE(EXCLUDED.member_id, address_roles.member_id), updated_at = CURRENT_TIMESTAMP",
            address, memberId, result.toMask()
        );

        outboxService.saveEvent(AggregateTypes.MEMBER, address,
            RoleAssignedEvent.EVENT_TYPE, RoleAssignedEvent.of(address, memberId, roles, result, grantedBy));

        log.info("Roles assigned: address={}, granted={}, now={}", address, roles, result);
        return result;
    }

    private RowMapper<Member> memberRowMapper() {
        return (rs, rowNum) -> new Member(
            rs.getString("member_id"),
            rs.getString("name"),
            rs.getString("country"),
            MemberStatus.valueOf(rs.getString("status")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
