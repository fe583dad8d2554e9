package com.flagship.gold_ledger.health;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness endpoint that needs no caller address.
 *
 * Beyond reaching the database it checks that the id sequences for IGAN accounts and gold-bar
 * tokens exist and reports a small ledger snapshot.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    static final String[] ID_SEQUENCES = {"account_igan_seq", "gold_asset_token_seq"};

    private static final String SNAPSHOT_SQL = """
        SELECT (SELECT COUNT(*) FROM accounts) AS accounts,
               (SELECT COALESCE(SUM(balance), 0) FROM accounts) AS units,
               (SELECT COUNT(*) FROM gold_assets WHERE status <> 'BURNED') AS live_assets,
               (SELECT COUNT(*) FROM settlement_orders
                 WHERE status IN ('PENDING_COUNTERPARTY', 'PENDING_EXECUTION')) AS pending_orders,
               (SELECT COUNT(*) FROM pg_class
                 WHERE relkind = 'S' AND relname IN ('account_igan_seq', 'gold_asset_token_seq')) AS sequences
        """;

    private final JdbcTemplate jdbcTemplate;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("service", "gold-custody-ledger");
        response.put("timestamp", Instant.now().toString());

        Map<String, Object> ledger;
        try {
            ledger = jdbcTemplate.queryForObject(SNAPSHOT_SQL, (rs, rowNum) -> {
                Map<String, Object> snapshot = new LinkedHashMap<>();
                snapshot.put("accounts", rs.getLong("accounts"));
                snapshot.put("units", rs.getLong("units"));
                snapshot.put("liveAssets", rs.getLong("live_assets"));
                snapshot.put("pendingOrders", rs.getLong("pending_orders"));
                snapshot.put("sequences", rs.getInt("sequences") == ID_SEQUENCES.length ? "UP" : "MISSING");
                return snapshot;
            });
            response.put("database", "UP");
        } catch (DataAccessException e) {
            log.warn("Health check could not read the ledger: {}", e.getMessage());
            response.put("database", "DOWN");
            response.put("status", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }

        response.put("ledger", ledger);
        if (!"UP".equals(ledger.get("sequences"))) {
            response.put("status", "DOWN");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
