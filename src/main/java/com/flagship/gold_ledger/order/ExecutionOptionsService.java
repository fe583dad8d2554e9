package com.flagship.gold_ledger.order;

import com.flagship.gold_ledger.member.AuthorizationRegistry;
import com.flagship.gold_ledger.member.Role;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * Persisted execution options. Until the platform sets them, the configured defaults apply.
 */
@Service
@Slf4j
public class ExecutionOptionsService {

    private static final int OPTIONS_ROW_ID = 1;
    private static final String DEFAULTS_SOURCE = "config";

    private final JdbcTemplate jdbcTemplate;
    private final AuthorizationRegistry registry;
    private final boolean defaultOnChainTransfer;
    private final boolean defaultAutoLedgerUpdate;

    public ExecutionOptionsService(JdbcTemplate jdbcTemplate,
                                   AuthorizationRegistry registry,
                                   @Value("${settlement.execution.on-chain-transfer:true}") boolean defaultOnChainTransfer,
                                   @Value("${settlement.execution.auto-ledger-update:true}") boolean defaultAutoLedgerUpdate) {
        this.jdbcTemplate = jdbcTemplate;
        this.registry = registry;
        this.defaultOnChainTransfer = defaultOnChainTransfer;
        this.defaultAutoLedgerUpdate = defaultAutoLedgerUpdate;
    }

    @Transactional(readOnly = true)
    public ExecutionOptions getOptions() {
        List<ExecutionOptions> rows = jdbcTemplate.query(
            "SELECT on_chain_transfer, auto_ledger_update, updated_by, updated_at FROM settlement_options WHERE id = ?",
            (rs, rowNum) -> new ExecutionOptions(
                rs.getBoolean("on_chain_transfer"),
                rs.getBoolean("auto_ledger_update"),
                rs.getString("updated_by"),
                toInstant(rs.getTimestamp("updated_at"))
            ),
            OPTIONS_ROW_ID
        );
        if (rows.isEmpty()) {
            return new ExecutionOptions(defaultOnChainTransfer, defaultAutoLedgerUpdate, DEFAULTS_SOURCE, null);
        }
        return rows.get(0);
    }

    /**
     * Requires PLATFORM.
     */
    @Transactional
    public ExecutionOptions setOptions(String caller, boolean onChainTransfer, boolean autoLedgerUpdate) {
        registry.requireAnyRole(caller, Role.PLATFORM);

        jdbcTemplate.update(
            "INSERT INTO settlement_options (id, on_chain_transfer, auto_ledger_update, updated_by, updated_at) " +
            "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (id) DO UPDATE SET on_chain_transfer = EXCLUDED.on_chain_transfer, " +
            "auto_ledger_update = EXCLUDED.auto_ledger_update, updated_by = EXCLUDED.updated_by, " +
            "updated_at = CURRENT_TIMESTAMP",
            OPTIONS_ROW_ID, onChainTransfer, autoLedgerUpdate, caller
        );

        log.info("Execution options set: onChainTransfer={}, autoLedgerUpdate={}, by={}",
            onChainTransfer, autoLedgerUpdate, caller);
        return getOptions();
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
