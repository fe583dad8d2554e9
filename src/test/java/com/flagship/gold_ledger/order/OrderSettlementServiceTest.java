package com.flagship.gold_ledger.order;

import com.flagship.gold_ledger.IntegrationTestBase;
import com.flagship.gold_ledger.asset.AssetStatus;
import com.flagship.gold_ledger.asset.GoldAsset;
import com.flagship.gold_ledger.exception.AuthorizationException;
import com.flagship.gold_ledger.exception.ComplianceException;
import com.flagship.gold_ledger.exception.DuplicateException;
import com.flagship.gold_ledger.exception.InsufficientBalanceException;
import com.flagship.gold_ledger.exception.InvalidStateException;
import com.flagship.gold_ledger.exception.NotFoundException;
import com.flagship.gold_ledger.member.Role;
import com.flagship.gold_ledger.outbox.AggregateTypes;
import com.flagship.gold_ledger.outbox.OutboxEvent;
import com.flagship.gold_ledger.outbox.OutboxService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for the three-phase settlement protocol.
 *
 * These tests verify that:
 * - Phases run in order and an order executes at most once
 * - Execution moves tokens and balances together or not at all
 * - Settlement delivers tokens even while they are under a custody lock
 * - A transaction reference can only be used once
 */
class OrderSettlementServiceTest extends IntegrationTestBase {

    private static final byte[] SIGNATURE = {0x0a, 0x1b, 0x2c};

    @Autowired
    private OrderSettlementService settlementService;

    @Autowired
    private OutboxService outboxService;

    private String platform;
    private String custodian;
    private String refiner;
    private String seller;
    private String buyer;
    private String sourceAccount;
    private String destAccount;

    @BeforeEach
    void setUp() {
        platform = addressWithRoles("platform", Role.PLATFORM);
        custodian = addressWithRoles("custodian", Role.CUSTODIAN);
        refiner = addressWithRoles("refiner", Role.REFINER);
        seller = uniqueAddress("seller");
        buyer = uniqueAddress("buyer");
        sourceAccount = openAccount(seller);
        destAccount = openAccount(buyer);
    }

    @AfterEach
    void restoreExecutionOptions() {
        settlementService.setExecutionOptions(platform, true, true);
    }

    private static String newTxRef() {
        return "TX-" + UUID.randomUUID();
    }

    private String prepare(String txRef, List<Long> tokenIds) {
        return settlementService.prepareOrder(platform, "EXT-" + txRef, txRef, OrderType.SALE,
            "MBR-SELLER", "MBR-BUYER", sourceAccount, destAccount, tokenIds, List.of(),
            LocalDate.of(2026, 11, 2), CurrencyCode.USD, new BigDecimal("75000.00"),
            new BigDecimal("25.00"), "{\"desk\":\"DXB\"}");
    }

    @Nested
    @DisplayName("full protocol")
    class FullProtocol {

        @Test
        @DisplayName("Prepare, sign and execute moves the bar and one ledger unit")
        void testPrepareSignExecute() {
            printTestHeader("Prepare / Sign / Execute");

            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = newTxRef();
            printInput("txRef", txRef);
            printInput("Token", tokenId);

            assertEquals(txRef, prepare(txRef, List.of(tokenId)));
            SettlementOrder prepared = settlementService.getOrder(txRef);
            assertEquals(OrderStatus.PENDING_COUNTERPARTY, prepared.getStatus());
            assertEquals(1, prepared.getQuantity());
            assertEquals(List.of(tokenId), prepared.getTokenIds());

            SettlementOrder signed = settlementService.signOrder(buyer, txRef, SIGNATURE, "BUYER");
            assertEquals(OrderStatus.PENDING_EXECUTION, signed.getStatus());
            assertEquals("0a1b2c", signed.getSignature());
            assertEquals(buyer, signed.getSignerAddress());

            SettlementOrder executed = settlementService.executeOrder(custodian, txRef);
            printOutput("Status", executed.getStatus());

            assertEquals(OrderStatus.EXECUTED, executed.getStatus());
            assertNotNull(executed.getExecutedAt());
            assertEquals(0L, ledgerService.getAccountBalance(sourceAccount));
            assertEquals(1L, ledgerService.getAccountBalance(destAccount));

            GoldAsset asset = assetService.getAsset(tokenId);
            assertEquals(buyer, asset.getOwnerAddress());
            assertEquals(AssetStatus.IN_VAULT, asset.getStatus());

            List<String> eventTypes = outboxService.getEventsForAggregate(AggregateTypes.ORDER, txRef)
                .stream().map(OutboxEvent::getEventType).toList();
            assertEquals(List.of("OrderCreated", "OrderPrepared", "OrderSigned", "OrderExecuted"), eventTypes);
            printSuccess("Bar and balance settled to the counterparty");
        }

        @Test
        @DisplayName("Second execution of the same order fails and changes nothing")
        void testExecuteTwice() {
            printTestHeader("Re-execute Order");

            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = newTxRef();
            prepare(txRef, List.of(tokenId));
            settlementService.signOrder(buyer, txRef, SIGNATURE, "BUYER");
            settlementService.executeOrder(platform, txRef);

            InvalidStateException e = assertThrows(InvalidStateException.class,
                () -> settlementService.executeOrder(platform, txRef));
            printExpectedException("InvalidStateException", e.getMessage());

            assertEquals(InvalidStateException.INVALID_ORDER_STATE, e.getCode());
            assertEquals(0L, ledgerService.getAccountBalance(sourceAccount));
            assertEquals(1L, ledgerService.getAccountBalance(destAccount));
        }

        @Test
        @DisplayName("Execution without a counterparty signature is rejected")
        void testExecuteWithoutSignature() {
            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = newTxRef();
            prepare(txRef, List.of(tokenId));

            assertThrows(InvalidStateException.class, () -> settlementService.executeOrder(platform, txRef));
            assertEquals(OrderStatus.PENDING_COUNTERPARTY, settlementService.getOrder(txRef).getStatus());
            assertEquals(seller, assetService.getAsset(tokenId).getOwnerAddress());
        }

        @Test
        @DisplayName("An order cannot be signed twice")
        void testSignTwice() {
            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = newTxRef();
            prepare(txRef, List.of(tokenId));
            settlementService.signOrder(buyer, txRef, SIGNATURE, "BUYER");

            assertThrows(InvalidStateException.class,
                () -> settlementService.signOrder(buyer, txRef, SIGNATURE, "BUYER"));
        }
    }

    @Nested
    @DisplayName("custody locks")
    class CustodyLocks {

        @Test
        @DisplayName("Pledged bar settles to the counterparty and ends IN_VAULT")
        void testPledgedBarSettles() {
            printTestHeader("Settle Pledged Bar");

            long tokenId = mintBar(refiner, seller, sourceAccount);
            assetService.updateStatus(custodian, tokenId, AssetStatus.PLEDGED, "collateral");
            assertTrue(assetService.isAssetLocked(tokenId));

            String txRef = newTxRef();
            prepare(txRef, List.of(tokenId));
            settlementService.signOrder(buyer, txRef, SIGNATURE, "BUYER");
            settlementService.executeOrder(platform, txRef);

            GoldAsset asset = assetService.getAsset(tokenId);
            printOutput("Status", asset.getStatus());
            assertEquals(buyer, asset.getOwnerAddress());
            assertEquals(AssetStatus.IN_VAULT, asset.getStatus());
            assertFalse(assetService.isAssetLocked(tokenId));
            printSuccess("Settlement overrides the custody lock");
        }
    }

    @Nested
    @DisplayName("atomicity")
    class Atomicity {

        @Test
        @DisplayName("Insufficient source balance rolls back the token move and the status change")
        void testInsufficientBalanceRollsBack() {
            printTestHeader("Atomic Rollback");

            long tokenId = mintBar(refiner, seller, sourceAccount);
            ledgerService.updateBalance(platform, sourceAccount, -1, "ADJUST", "REF");
            String txRef = newTxRef();
            prepare(txRef, List.of(tokenId));
            settlementService.signOrder(buyer, txRef, SIGNATURE, "BUYER");

            InsufficientBalanceException e = assertThrows(InsufficientBalanceException.class,
                () -> settlementService.executeOrder(platform, txRef));
            printExpectedException("InsufficientBalanceException", e.getMessage());

            assertEquals(OrderStatus.PENDING_EXECUTION, settlementService.getOrder(txRef).getStatus());
            GoldAsset asset = assetService.getAsset(tokenId);
            assertEquals(seller, asset.getOwnerAddress(), "Token move must be rolled back");
            assertEquals(AssetStatus.REGISTERED, asset.getStatus());
            assertEquals(0L, ledgerService.getAccountBalance(sourceAccount));
            assertEquals(0L, ledgerService.getAccountBalance(destAccount));
            printSuccess("Nothing applied");
        }

        @Test
        @DisplayName("Disabled settlement capability blocks execution entirely")
        void testDisabledCapabilityBlocksExecution() {
            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = newTxRef();
            prepare(txRef, List.of(tokenId));
            settlementService.signOrder(buyer, txRef, SIGNATURE, "BUYER");

            ledgerService.setBalanceUpdater(platform, "order-settlement", false);
            try {
                assertThrows(AuthorizationException.class, () -> settlementService.executeOrder(platform, txRef));
            } finally {
                ledgerService.setBalanceUpdater(platform, "order-settlement", true);
            }

            assertEquals(seller, assetService.getAsset(tokenId).getOwnerAddress());
            assertEquals(OrderStatus.PENDING_EXECUTION, settlementService.getOrder(txRef).getStatus());
        }
    }

    @Nested
    @DisplayName("execution options")
    class Options {

        @Test
        @DisplayName("With both options off, execution only changes the order status")
        void testOptionsDisabled() {
            printTestHeader("Execution Options Disabled");

            ExecutionOptions options = settlementService.setExecutionOptions(platform, false, false);
            assertFalse(options.isOnChainTransfer());
            assertFalse(options.isAutoLedgerUpdate());
            assertEquals(platform, options.getUpdatedBy());

            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = newTxRef();
            prepare(txRef, List.of(tokenId));
            settlementService.signOrder(buyer, txRef, SIGNATURE, "BUYER");

            assertEquals(OrderStatus.EXECUTED, settlementService.executeOrder(platform, txRef).getStatus());
            assertEquals(seller, assetService.getAsset(tokenId).getOwnerAddress());
            assertEquals(1L, ledgerService.getAccountBalance(sourceAccount));
            assertEquals(0L, ledgerService.getAccountBalance(destAccount));
            printSuccess("Tokens and balances untouched");
        }

        @Test
        @DisplayName("Only PLATFORM can change execution options")
        void testOptionsRequirePlatform() {
            assertThrows(AuthorizationException.class,
                () -> settlementService.setExecutionOptions(custodian, false, false));
            assertTrue(settlementService.getExecutionOptions().isOnChainTransfer());
        }
    }

    @Nested
    @DisplayName("prepare")
    class Prepare {

        @Test
        @DisplayName("A transaction reference can only be used once")
        void testDuplicateTxRef() {
            printTestHeader("Duplicate txRef");

            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = newTxRef();
            prepare(txRef, List.of(tokenId));

            DuplicateException e = assertThrows(DuplicateException.class, () -> prepare(txRef, List.of(tokenId)));
            printExpectedException("DuplicateException", e.getMessage());
            assertEquals(DuplicateException.TX_REF_ALREADY_USED, e.getCode());
        }

        @Test
        @DisplayName("Oversized external reference is a bad request, not a reused txRef")
        void testOversizedExternalRef() {
            printTestHeader("Oversized External Reference");

            String txRef = newTxRef();
            String externalRef = "EXT-" + "x".repeat(200);

            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> settlementService.prepareOrder(platform, externalRef, txRef, OrderType.SALE,
                    "MBR-SELLER", "MBR-BUYER", sourceAccount, destAccount, List.of(), List.of("1kg bar"),
                    null, null, null, null, null));
            printExpectedException("IllegalArgumentException", e.getMessage());

            assertThrows(NotFoundException.class, () -> settlementService.getOrder(txRef));
        }

        @Test
        @DisplayName("Cached reference in Redis is rejected without a database hit")
        void testDuplicateTxRef_RedisFastPath() {
            String txRef = newTxRef();
            when(valueOperations.get("settlement:txref:" + txRef)).thenReturn("1");

            assertThrows(DuplicateException.class, () -> prepare(txRef, List.of()));
            assertThrows(NotFoundException.class, () -> settlementService.getOrder(txRef));
        }

        @Test
        @DisplayName("Reference is cached in Redis after the order commits")
        void testTxRefCachedAfterCommit() {
            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = newTxRef();
            prepare(txRef, List.of(tokenId));

            verify(valueOperations).set(eq("settlement:txref:" + txRef), eq("1"), any(Duration.class));
        }

        @Test
        @DisplayName("Unknown token or account is rejected")
        void testUnknownReferences() {
            assertThrows(NotFoundException.class, () -> prepare(newTxRef(), List.of(Long.MAX_VALUE)));
            assertThrows(NotFoundException.class,
                () -> settlementService.prepareOrder(platform, null, newTxRef(), OrderType.TRANSFER,
                    "A", "B", sourceAccount, "IGAN-0", List.of(), List.of("1kg bar"),
                    null, null, null, null, null));
        }

        @Test
        @DisplayName("Order without tokens or requested assets is rejected")
        void testEmptyOrder() {
            assertThrows(IllegalArgumentException.class, () -> prepare(newTxRef(), List.of()));
        }

        @Test
        @DisplayName("Requested-asset order executes without moving balances")
        void testRequestedAssetsOnly() {
            String txRef = newTxRef();
            settlementService.prepareOrder(platform, null, txRef, OrderType.PURCHASE, "MBR-B", "MBR-S",
                sourceAccount, destAccount, List.of(), List.of("1kg LBMA bar"), null, CurrencyCode.AED,
                null, null, null);
            settlementService.signOrder(seller, txRef, SIGNATURE, "SELLER");

            SettlementOrder executed = settlementService.executeOrder(platform, txRef);
            assertEquals(0, executed.getQuantity());
            assertEquals(List.of("1kg LBMA bar"), executed.getRequestedAssets());
            assertEquals(0L, ledgerService.getAccountBalance(destAccount));
        }

        @Test
        @DisplayName("Prepare requires PLATFORM")
        void testPrepareRequiresPlatform() {
            String txRef = newTxRef();
            assertThrows(AuthorizationException.class,
                () -> settlementService.prepareOrder(custodian, null, txRef, OrderType.SALE, "A", "B",
                    sourceAccount, destAccount, List.of(), List.of("bar"), null, null, null, null, null));
            assertThrows(NotFoundException.class, () -> settlementService.getOrder(txRef));
        }
    }

    @Nested
    @DisplayName("closing")
    class Closing {

        @Test
        @DisplayName("Cancelled order cannot be signed or executed")
        void testCancel() {
            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = newTxRef();
            prepare(txRef, List.of(tokenId));

            SettlementOrder cancelled = settlementService.cancelOrder(platform, txRef, "client withdrew");
            assertEquals(OrderStatus.CANCELLED, cancelled.getStatus());
            assertEquals("client withdrew", cancelled.getClosingReason());

            assertThrows(InvalidStateException.class,
                () -> settlementService.signOrder(buyer, txRef, SIGNATURE, "BUYER"));
            assertThrows(InvalidStateException.class, () -> settlementService.executeOrder(platform, txRef));
            assertTrue(settlementService.getOrdersByStatus(OrderStatus.CANCELLED).stream()
                .anyMatch(o -> o.getTxRef().equals(txRef)));
        }

        @Test
        @DisplayName("Custodian can fail a signed order; executed orders cannot be failed")
        void testFail() {
            long first = mintBar(refiner, seller, sourceAccount);
            String failedRef = newTxRef();
            prepare(failedRef, List.of(first));
            settlementService.signOrder(buyer, failedRef, SIGNATURE, "BUYER");
            assertEquals(OrderStatus.FAILED,
                settlementService.failOrder(custodian, failedRef, "vault unreachable").getStatus());

            long second = mintBar(refiner, seller, sourceAccount);
            String executedRef = newTxRef();
            prepare(executedRef, List.of(second));
            settlementService.signOrder(buyer, executedRef, SIGNATURE, "BUYER");
            settlementService.executeOrder(platform, executedRef);

            assertThrows(InvalidStateException.class,
                () -> settlementService.failOrder(custodian, executedRef, "late"));
            assertThrows(InvalidStateException.class,
                () -> settlementService.cancelOrder(platform, executedRef, "late"));
        }

        @Test
        @DisplayName("Blacklisted signer is refused")
        void testBlacklistedSigner() {
            long tokenId = mintBar(refiner, seller, sourceAccount);
            String txRef = newTxRef();
            prepare(txRef, List.of(tokenId));
            registryService.setBlacklisted(ADMIN, buyer, true, "sanctions");

            assertThrows(ComplianceException.class,
                () -> settlementService.signOrder(buyer, txRef, SIGNATURE, "BUYER"));
            assertEquals(OrderStatus.PENDING_COUNTERPARTY, settlementService.getOrder(txRef).getStatus());
        }
    }
}
