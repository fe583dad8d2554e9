package com.flagship.gold_ledger.ledger;

import com.flagship.gold_ledger.exception.AuthorizationException;
import com.flagship.gold_ledger.exception.InsufficientBalanceException;
import com.flagship.gold_ledger.exception.MemberNotActiveException;
import com.flagship.gold_ledger.exception.NotFoundException;
import com.flagship.gold_ledger.ledger.event.AccountCreatedEvent;
import com.flagship.gold_ledger.ledger.event.BalanceUpdatedEvent;
import com.flagship.gold_ledger.ledger.event.BalanceUpdaterSetEvent;
import com.flagship.gold_ledger.member.AuthorizationRegistry;
import com.flagship.gold_ledger.member.MemberStatus;
import com.flagship.gold_ledger.member.Role;
import com.flagship.gold_ledger.observability.CorrelationContext;
import com.flagship.gold_ledger.observability.CustodyMetrics;
import com.flagship.gold_ledger.outbox.AggregateTypes;
import com.flagship.gold_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Balance bookkeeping per gold account.
 *
 * Invariants enforced here:
 * 1. A balance never goes negative: checked under a row lock, guarded again in the UPDATE
 *    and finally by a CHECK constraint.
 * 2. Balances move only through {@link #updateBalance} (operator path) or
 *    {@link #updateBalanceFromContract} (capability path); both share {@link #applyDelta}.
 * 3. Every change writes a BalanceUpdated event to the outbox in the same transaction.
 */
@Service
@Slf4j
public class AccountLedgerService {

    private static final String ACCOUNT_PREFIX = "IGAN-";
    private static final String OPERATOR_CHANNEL = "operator";
    private static final String ACCOUNT_COLUMNS =
        "account_id, member_id, address, balance, last_reason, last_reference, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;
    private final AuthorizationRegistry registry;
    private final OutboxService outboxService;
    private final CustodyMetrics metrics;

    private final Map<String, LedgerWriteCapability> issuedCapabilities = new ConcurrentHashMap<>();

    public AccountLedgerService(JdbcTemplate jdbcTemplate,
                                AuthorizationRegistry registry,
                                OutboxService outboxService,
                                CustodyMetrics metrics) {
        this.jdbcTemplate = jdbcTemplate;
        this.registry = registry;
        this.outboxService = outboxService;
        this.metrics = metrics;
    }

    /**
     * Opens an account for an ACTIVE member.
     *
     * @return the new account id, e.g. {@code IGAN-1000}
     * @throws MemberNotActiveException if the member is unknown or not ACTIVE
     */
    @Transactional
    public String createAccount(String caller, String memberId, String address) {
        registry.requireAnyRole(caller, Role.PLATFORM);
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Account address is required");
        }

        MemberStatus status = registry.findMemberStatus(memberId)
            .orElseThrow(() -> MemberNotActiveException.unregistered(memberId));
        if (status != MemberStatus.ACTIVE) {
            throw new MemberNotActiveException(memberId, status);
        }

        Long sequence = jdbcTemplate.queryForObject("SELECT nextval('account_igan_seq')", Long.class);
        String accountId = ACCOUNT_PREFIX + sequence;

        jdbcTemplate.update(
            "INSERT INTO accounts (account_id, member_id, address, balance, created_at, updated_at) " +
            "VALUES (?, ?, ?, 0, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            accountId, memberId, address
        );

        Account account = getAccount(accountId);
        outboxService.saveEvent(AggregateTypes.ACCOUNT, accountId,
            AccountCreatedEvent.EVENT_TYPE, AccountCreatedEvent.of(account, caller));

        log.info("Account created: accountId={}, memberId={}, address={}", accountId, memberId, address);
        return accountId;
    }

    /**
     * Operator balance correction. Requires PLATFORM or CUSTODIAN.
     *
     * @return the resulting balance
     */
    @Transactional
    public long updateBalance(String caller, String accountId, long delta, String reason, String refId) {
        registry.requireAnyRole(caller, Role.PLATFORM, Role.CUSTODIAN);
        return applyDelta(accountId, delta, reason, refId, OPERATOR_CHANNEL, caller);
    }

    /**
     * Contract-driven balance update used by asset custody and order settlement.
     *
     * @throws AuthorizationException if the capability was not issued by this ledger or its
     *         holder has been disabled through {@link #setBalanceUpdater}
     */
    @Transactional
    public long updateBalanceFromContract(LedgerWriteCapability capability, String accountId,
                                          long delta, String reason, String refId) {
        verifyCapability(capability);
        return applyDelta(accountId, delta, reason, refId, capability.getHolder(), capability.getHolder());
    }

    /**
     * Enables or disables a capability holder. Requires PLATFORM.
     */
    @Transactional
    public void setBalanceUpdater(String caller, String holder, boolean enabled) {
        registry.requireAnyRole(caller, Role.PLATFORM);
        if (holder == null || holder.isBlank()) {
            throw new IllegalArgumentException("Balance updater holder is required");
        }

        jdbcTemplate.update(
            "INSERT INTO balance_updaters (holder, enabled, updated_by, updated_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (holder) DO UPDATE SET enabled = EXCLUDED.enabled, " +
            "updated_by = EXCLUDED.updated_by, updated_at = CURRENT_TIMESTAMP",
            holder, enabled, caller
        );

        outboxService.saveEvent(AggregateTypes.ACCOUNT, holder,
            BalanceUpdaterSetEvent.EVENT_TYPE, BalanceUpdaterSetEvent.of(holder, enabled, caller));

        log.info("Balance updater set: holder={}, enabled={}, by={}", holder, enabled, caller);
    }

    /**
     * A holder without a row has never been disabled.
     */
    @Transactional(readOnly = true)
    public boolean isBalanceUpdaterEnabled(String holder) {
        List<Boolean> flags = jdbcTemplate.queryForList(
            "SELECT enabled FROM balance_updaters WHERE holder = ?", Boolean.class, holder);
        return flags.isEmpty() || Boolean.TRUE.equals(flags.get(0));
    }

    @Transactional(readOnly = true)
    public long getAccountBalance(String accountId) {
        return getAccount(accountId).getBalance();
    }

    @Transactional(readOnly = true)
    public Account getAccount(String accountId) {
        return findAccount(accountId).orElseThrow(() -> NotFoundException.account(accountId));
    }

    @Transactional(readOnly = true)
    public Optional<Account> findAccount(String accountId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE account_id = ?",
            accountRowMapper(), accountId
        ).stream().findFirst();
    }

    @Transactional(readOnly = true)
    public List<Account> getAccountsByMember(String memberId) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE member_id = ? ORDER BY created_at, account_id",
            accountRowMapper(), memberId);
    }

    @Transactional(readOnly = true)
    public List<Account> getAccountsByAddress(String address) {
        return jdbcTemplate.query(
            "SELECT " + ACCOUNT_COLUMNS + " FROM accounts WHERE address = ? ORDER BY created_at, account_id",
            accountRowMapper(), address);
    }

    /**
     * Issues the capability for a holder. One per holder; called only from
     * {@link LedgerCapabilityConfig} while the context is wired.
     */
    LedgerWriteCapability grantWriteCapability(String holder) {
        LedgerWriteCapability capability = new LedgerWriteCapability(holder);
        if (issuedCapabilities.putIfAbsent(holder, capability) != null) {
            throw new IllegalStateException("Ledger write capability already issued to " + holder);
        }
        log.info("Issued {}", capability);
        return capability;
    }

    private void verifyCapability(LedgerWriteCapability capability) {
        if (capability == null || issuedCapabilities.get(capability.getHolder()) != capability) {
            throw new AuthorizationException(AuthorizationException.UNAUTHORIZED_ROLE,
                "Ledger write capability was not issued by this ledger");
        }
        if (!isBalanceUpdaterEnabled(capability.getHolder())) {
            throw new AuthorizationException(AuthorizationException.UNAUTHORIZED_ROLE,
                "Balance updater is disabled: " + capability.getHolder());
        }
    }

    private long applyDelta(String accountId, long delta, String reason, String refId,
                            String channel, String updatedBy) {
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, accountId);
        try {
            List<Long> balances = jdbcTemplate.queryForList(
                "SELECT balance FROM accounts WHERE account_id = ? FOR UPDATE", Long.class, accountId);
            if (balances.isEmpty()) {
                metrics.recordBalanceUpdate(channel, "not_found");
                throw NotFoundException.account(accountId);
            }

            long balance = balances.get(0);
            long newBalance;
            try {
                newBalance = Math.addExact(balance, delta);
            } catch (ArithmeticException e) {
                throw new IllegalArgumentException("Balance overflow on account " + accountId, e);
            }
            if (newBalance < 0) {
                metrics.recordBalanceUpdate(channel, "insufficient_balance");
                throw new InsufficientBalanceException(accountId, balance, delta);
            }

            int updated = jdbcTemplate.update(
                "UPDATE accounts SET balance = balance + ?, last_reason = ?, last_reference = ?, " +
                "updated_at = CURRENT_TIMESTAMP WHERE account_id = ? AND balance + ? >= 0",
                delta, reason, refId, accountId, delta
            );
            if (updated == 0) {
                metrics.recordBalanceUpdate(channel, "insufficient_balance");
                throw new InsufficientBalanceException(accountId, balance, delta);
            }

            outboxService.saveEvent(AggregateTypes.ACCOUNT, accountId, BalanceUpdatedEvent.EVENT_TYPE,
                BalanceUpdatedEvent.of(accountId, delta, newBalance, reason, refId, channel, updatedBy));

            metrics.recordBalanceUpdate(channel, "success");
            log.info("Balance updated: delta={}, newBalance={}, reason={}, ref={}, channel={}",
                delta, newBalance, reason, refId, channel);
            return newBalance;
        } finally {
            MDC.remove(CorrelationContext.ACCOUNT_ID_MDC_KEY);
        }
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            rs.getString("account_id"),
            rs.getString("member_id"),
            rs.getString("address"),
            rs.getLong("balance"),
            rs.getString("last_reason"),
            rs.getString("last_reference"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
