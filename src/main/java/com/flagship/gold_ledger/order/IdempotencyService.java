package com.flagship.gold_ledger.order;

import com.flagship.gold_ledger.observability.CustodyMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.util.Optional;

/**
 * Tracks consumed settlement references.
 *
 * Strategy:
 * 1. Try Redis first (fast, but can be unavailable)
 * 2. Fall back to the orders table, which is authoritative
 * 3. Cache references in Redis only after the order has committed
 *
 * The primary key on {@code settlement_orders.tx_ref} remains the final guard.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "settlement:txref:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final OrderPersistenceService persistenceService;
    private final Optional<StringRedisTemplate> redisTemplate;
    private final CustodyMetrics metrics;

    public IdempotencyService(OrderPersistenceService persistenceService,
                              Optional<StringRedisTemplate> redisTemplate,
                              CustodyMetrics metrics) {
        this.persistenceService = persistenceService;
        this.redisTemplate = redisTemplate;
        this.metrics = metrics;
    }

    /**
     * @return true if an order with this reference was ever created
     */
    public boolean isTxRefUsed(String txRef) {
        if (txRef == null || txRef.isBlank()) {
            throw new IllegalArgumentException("Transaction reference cannot be null or blank");
        }

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + txRef);
                if (cached != null) {
                    log.debug("Transaction reference found in Redis: {}", txRef);
                    metrics.recordIdempotencyHit();
                    return true;
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for txRef {}. Falling back to database. Error: {}",
                        txRef, e.getMessage());
            }
        }

        if (persistenceService.exists(txRef)) {
            log.debug("Transaction reference found in database: {}", txRef);
            metrics.recordIdempotencyHit();
            cache(txRef);
            return true;
        }

        metrics.recordIdempotencyMiss();
        return false;
    }

    /**
     * Caches the reference once the surrounding transaction commits; a rolled-back prepare
     * leaves the reference free.
     */
    public void recordTxRef(String txRef) {
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    cache(txRef);
                }
            });
        } else {
            cache(txRef);
        }
    }

    private void cache(String txRef) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + txRef, "1", REDIS_TTL);
        } catch (Exception e) {
            // Database is the source of truth; a missed cache write only costs a lookup.
            log.debug("Failed to cache txRef in Redis: {}", e.getMessage());
        }
    }
}
