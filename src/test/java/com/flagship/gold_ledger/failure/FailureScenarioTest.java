package com.flagship.gold_ledger.failure;

import com.flagship.gold_ledger.IntegrationTestBase;
import com.flagship.gold_ledger.exception.DuplicateException;
import com.flagship.gold_ledger.exception.InsufficientBalanceException;
import com.flagship.gold_ledger.exception.InvalidStateException;
import com.flagship.gold_ledger.member.Role;
import com.flagship.gold_ledger.order.CurrencyCode;
import com.flagship.gold_ledger.order.OrderSettlementService;
import com.flagship.gold_ledger.order.OrderStatus;
import com.flagship.gold_ledger.order.OrderType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.redis.RedisConnectionFailureException;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

/**
 * Failure scenarios: the custody records stay consistent when Redis is down and when the same
 * order or account is hit concurrently.
 */
class FailureScenarioTest extends IntegrationTestBase {

    @Autowired
    private OrderSettlementService settlementService;

    private String platform;
    private String refiner;
    private String seller;
    private String buyer;
    private String sourceAccount;
    private String destAccount;

    @BeforeEach
    void setUp() {
        platform = addressWithRoles("platform", Role.PLATFORM);
        refiner = addressWithRoles("refiner", Role.REFINER);
        seller = uniqueAddress("seller");
        buyer = uniqueAddress("buyer");
        sourceAccount = openAccount(seller);
        destAccount = openAccount(buyer);
    }

    private void printSection(String sectionName) {
        System.out.println("\n--- " + sectionName + " ---");
    }

    private void printInvariant(String invariant) {
        System.out.println("🔒 INVARIANT MAINTAINED: " + invariant);
    }

    private String prepareSigned(long tokenId) {
        return prepareSigned(List.of(tokenId));
    }

    private String prepareSigned(List<Long> tokenIds) {
        String txRef = "TX-" + UUID.randomUUID();
        settlementService.prepareOrder(platform, null, txRef, OrderType.TRANSFER, "MBR-S", "MBR-B",
            sourceAccount, destAccount, tokenIds, List.of(), null, CurrencyCode.CHF,
            BigDecimal.ZERO, BigDecimal.ZERO, null);
        settlementService.signOrder(buyer, txRef, new byte[]{1}, "BUYER");
        return txRef;
    }

    @Nested
    @DisplayName("1. Redis Failure Scenarios")
    class RedisFailureTests {

        @Test
        @DisplayName("1.1 Settlement keeps working when Redis is unavailable")
        void testRedisUnavailable_SystemContinuesOperating() {
            printTestHeader("Redis Unavailable");

            when(valueOperations.get(anyString()))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));
            doThrow(new RedisConnectionFailureException("Connection refused"))
                .when(valueOperations).set(anyString(), anyString(), any(Duration.class));

            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = prepareSigned(tokenId);

            assertEquals(OrderStatus.EXECUTED, settlementService.executeOrder(platform, txRef).getStatus());
            printSuccess("Order settled without Redis");
        }

        @Test
        @DisplayName("1.2 Duplicate txRef is caught by the database when Redis is down")
        void testIdempotency_DatabaseFallbackWorks() {
            printTestHeader("Database Fallback");

            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = prepareSigned(tokenId);

            when(valueOperations.get(anyString()))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));

            assertThrows(DuplicateException.class,
                () -> settlementService.prepareOrder(platform, null, txRef, OrderType.TRANSFER, "MBR-S",
                    "MBR-B", sourceAccount, destAccount, List.of(tokenId), List.of(), null, null,
                    null, null, null));
            printInvariant("settlement_orders.tx_ref is the source of truth");
        }
    }

    @Nested
    @DisplayName("2. Concurrency Scenarios")
    class ConcurrencyTests {

        @Test
        @DisplayName("2.1 Concurrent executions of one order settle it exactly once")
        void testConcurrentExecute_ExactlyOnce() throws Exception {
            printTestHeader("Concurrent Execute");

            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = prepareSigned(tokenId);

            int threads = 5;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger executed = new AtomicInteger();
            AtomicInteger rejected = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();

            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        settlementService.executeOrder(platform, txRef);
                        executed.incrementAndGet();
                    } catch (InvalidStateException e) {
                        rejected.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();

            printSection("Result");
            System.out.println("Executed: " + executed.get() + ", rejected: " + rejected.get());

            assertEquals(1, executed.get());
            assertEquals(threads - 1, rejected.get());
            assertEquals(0L, ledgerService.getAccountBalance(sourceAccount));
            assertEquals(1L, ledgerService.getAccountBalance(destAccount));
            printInvariant("Row lock on the order serializes execution");
        }

        @Test
        @DisplayName("2.2 Concurrent debits never drive a balance negative")
        void testConcurrentDebits_NeverNegative() throws Exception {
            printTestHeader("Concurrent Debits");

            ledgerService.updateBalance(platform, sourceAccount, 3, "DEPOSIT", "REF");

            int threads = 8;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger succeeded = new AtomicInteger();
            AtomicInteger insufficient = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();

            for (int i = 0; i < threads; i++) {
                String ref = "REF-" + i;
                Callable<Void> debit = () -> {
                    start.await();
                    try {
                        ledgerService.updateBalance(platform, sourceAccount, -1, "WITHDRAW", ref);
                        succeeded.incrementAndGet();
                    } catch (InsufficientBalanceException e) {
                        insufficient.incrementAndGet();
                    }
                    return null;
                };
                futures.add(executor.submit(debit));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();

            assertEquals(3, succeeded.get());
            assertEquals(threads - 3, insufficient.get());
            assertEquals(0L, ledgerService.getAccountBalance(sourceAccount));
            printInvariant("Balance never negative");
        }

        @Test
        @DisplayName("2.3 Orders listing the same bars in opposite order settle without deadlock")
        void testOppositeTokenOrder_NoDeadlock() throws Exception {
            printTestHeader("Opposite Lock Order");

            long first = mintBar(refiner, seller, sourceAccount);
            long second = mintBar(refiner, seller, sourceAccount);
            List<String> txRefs = List.of(
                prepareSigned(List.of(first, second)),
                prepareSigned(List.of(second, first)));

            ExecutorService executor = Executors.newFixedThreadPool(txRefs.size());
            CountDownLatch start = new CountDownLatch(1);
            AtomicInteger executed = new AtomicInteger();
            AtomicInteger insufficient = new AtomicInteger();
            List<Future<?>> futures = new ArrayList<>();

            for (String txRef : txRefs) {
                futures.add(executor.submit(() -> {
                    start.await();
                    try {
                        settlementService.executeOrder(platform, txRef);
                        executed.incrementAndGet();
                    } catch (InsufficientBalanceException e) {
                        insufficient.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
            executor.shutdown();

            printSection("Result");
            System.out.println("Executed: " + executed.get() + ", insufficient: " + insufficient.get());

            assertEquals(1, executed.get());
            assertEquals(1, insufficient.get());
            assertEquals(0L, ledgerService.getAccountBalance(sourceAccount));
            assertEquals(2L, ledgerService.getAccountBalance(destAccount));
            assertEquals(buyer, assetService.getAsset(first).getOwnerAddress());
            assertEquals(buyer, assetService.getAsset(second).getOwnerAddress());
            printInvariant("Token rows are locked in ascending id order");
        }
    }
}
