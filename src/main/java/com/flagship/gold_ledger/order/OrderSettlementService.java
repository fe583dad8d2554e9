package com.flagship.gold_ledger.order;

import com.flagship.gold_ledger.asset.AssetCustodyService;
import com.flagship.gold_ledger.exception.DuplicateException;
import com.flagship.gold_ledger.exception.NotFoundException;
import com.flagship.gold_ledger.ledger.AccountLedgerService;
import com.flagship.gold_ledger.ledger.LedgerWriteCapability;
import com.flagship.gold_ledger.member.AuthorizationRegistry;
import com.flagship.gold_ledger.member.Role;
import com.flagship.gold_ledger.observability.CorrelationContext;
import com.flagship.gold_ledger.observability.CustodyMetrics;
import com.flagship.gold_ledger.order.event.OrderCancelledEvent;
import com.flagship.gold_ledger.order.event.OrderCreatedEvent;
import com.flagship.gold_ledger.order.event.OrderExecutedEvent;
import com.flagship.gold_ledger.order.event.OrderFailedEvent;
import com.flagship.gold_ledger.order.event.OrderPreparedEvent;
import com.flagship.gold_ledger.order.event.OrderSignedEvent;
import com.flagship.gold_ledger.outbox.AggregateTypes;
import com.flagship.gold_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.List;

/**
 * Settlement protocol: prepare, counterparty sign, execute.
 *
 * This service ensures that:
 * 1. A transaction reference is consumed once, on prepare, and never reused
 * 2. Phases cannot be skipped and an order executes at most once
 * 3. Execution moves tokens and balances in the same transaction as the status change;
 *    if either side effect fails, nothing is applied
 * 4. Every transition writes its event to the outbox in that transaction
 */
@Service
@Slf4j
public class OrderSettlementService {

    static final String LEDGER_REASON = "ORDER";

    private final OrderPersistenceService persistenceService;
    private final IdempotencyService idempotencyService;
    private final ExecutionOptionsService executionOptionsService;
    private final AssetCustodyService assetCustodyService;
    private final AccountLedgerService ledgerService;
    private final LedgerWriteCapability ledgerCapability;
    private final AuthorizationRegistry registry;
    private final OutboxService outboxService;
    private final CustodyMetrics metrics;

    public OrderSettlementService(OrderPersistenceService persistenceService,
                                  IdempotencyService idempotencyService,
                                  ExecutionOptionsService executionOptionsService,
                                  AssetCustodyService assetCustodyService,
                                  AccountLedgerService ledgerService,
                                  @Qualifier("orderSettlementLedgerCapability") LedgerWriteCapability ledgerCapability,
                                  AuthorizationRegistry registry,
                                  OutboxService outboxService,
                                  CustodyMetrics metrics) {
        this.persistenceService = persistenceService;
        this.idempotencyService = idempotencyService;
        this.executionOptionsService = executionOptionsService;
        this.assetCustodyService = assetCustodyService;
        this.ledgerService = ledgerService;
        this.ledgerCapability = ledgerCapability;
        this.registry = registry;
        this.outboxService = outboxService;
        this.metrics = metrics;
    }

    /**
     * Creates an order in PENDING_COUNTERPARTY. Requires PLATFORM.
     *
     * Referenced accounts and tokens must exist at prepare time.
     *
     * @return the transaction reference
     * @throws DuplicateException if the reference was used before
     */
    @Transactional
    public String prepareOrder(String caller, String externalRef, String txRef, OrderType type,
                               String initiatorId, String counterpartyId,
                               String sourceAccountId, String destAccountId,
                               List<Long> tokenIds, List<String> requestedAssets,
                               LocalDate settlementDate, CurrencyCode currency,
                               BigDecimal price, BigDecimal fee, String metadata) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TX_REF_MDC_KEY, txRef);
        try {
            registry.requireAnyRole(caller, Role.PLATFORM);

            if (idempotencyService.isTxRefUsed(txRef)) {
                throw DuplicateException.txRef(txRef);
            }

            SettlementOrder order = SettlementOrder.prepare(txRef, externalRef, type, initiatorId,
                counterpartyId, sourceAccountId, destAccountId, tokenIds, requestedAssets,
                settlementDate, currency, price, fee, metadata);

            ledgerService.getAccount(sourceAccountId);
            ledgerService.getAccount(destAccountId);
            order.getTokenIds().forEach(assetCustodyService::getAsset);

            SettlementOrder saved = persistenceService.insert(order);
            idempotencyService.recordTxRef(txRef);

            publish(txRef, OrderCreatedEvent.EVENT_TYPE, OrderCreatedEvent.fromOrder(saved));
            publish(txRef, OrderPreparedEvent.EVENT_TYPE, OrderPreparedEvent.fromOrder(saved, caller));

            metrics.recordOrderPhase("prepare", "success");
            log.info("Order prepared: type={}, source={}, dest={}, tokens={}",
                type, sourceAccountId, destAccountId, saved.getTokenIds());
            return txRef;

        } catch (RuntimeException e) {
            metrics.recordOrderPhase("prepare", "error");
            log.warn("Order preparation failed: error={}", e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("order_prepare", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    /**
     * Records the counterparty signature and advances to PENDING_EXECUTION. One signature
     * from a non-blacklisted signer is enough.
     */
    @Transactional
    public SettlementOrder signOrder(String caller, String txRef, byte[] signature, String partyLabel) {
        MDC.put(CorrelationContext.TX_REF_MDC_KEY, txRef);
        try {
            if (caller == null || caller.isBlank()) {
                throw new IllegalArgumentException("Signer address is required");
            }
            if (signature == null || signature.length == 0) {
                throw new IllegalArgumentException("Signature cannot be empty");
            }

            SettlementOrder order = persistenceService.lockById(txRef);
            registry.requireNotBlacklisted(caller);

            SettlementOrder signed = persistenceService.update(
                order.sign(HexFormat.of().formatHex(signature), caller, partyLabel));

            publish(txRef, OrderSignedEvent.EVENT_TYPE, OrderSignedEvent.fromOrder(signed));

            metrics.recordOrderPhase("sign", "success");
            log.info("Order signed: signer={}, party={}", caller, partyLabel);
            return signed;

        } catch (RuntimeException e) {
            metrics.recordOrderPhase("sign", "error");
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    /**
     * Executes a signed order. Requires PLATFORM or CUSTODIAN.
     *
     * With on-chain transfer enabled, every token moves to the address linked to the
     * destination account, bypassing custody locks, and ends IN_VAULT. With auto ledger update
     * enabled, the source account is debited and the destination credited by the order
     * quantity. All of it commits with the EXECUTED status or not at all.
     */
    @Transactional
    public SettlementOrder executeOrder(String caller, String txRef) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TX_REF_MDC_KEY, txRef);
        try {
            registry.requireAnyRole(caller, Role.PLATFORM, Role.CUSTODIAN);

            SettlementOrder order = persistenceService.lockById(txRef);
            SettlementOrder executed = order.execute();
            ExecutionOptions options = executionOptionsService.getOptions();

            String newOwner = ledgerService.getAccount(order.getDestAccountId()).getAddress();

            if (options.isOnChainTransfer() && !order.getTokenIds().isEmpty()) {
                assetCustodyService.settleToCounterparty(order.getTokenIds(), newOwner, txRef);
            }

            if (options.isAutoLedgerUpdate() && order.getQuantity() > 0) {
                ledgerService.updateBalanceFromContract(ledgerCapability, order.getSourceAccountId(),
                    -order.getQuantity(), LEDGER_REASON, txRef);
                ledgerService.updateBalanceFromContract(ledgerCapability, order.getDestAccountId(),
                    order.getQuantity(), LEDGER_REASON, txRef);
            }

            SettlementOrder saved = persistenceService.update(executed);
            publish(txRef, OrderExecutedEvent.EVENT_TYPE,
                OrderExecutedEvent.fromOrder(saved, newOwner, options, caller));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOrderPhase("execute", "success");
            log.info("Order executed: quantity={}, newOwner={}, onChainTransfer={}, autoLedgerUpdate={}, duration={}ms",
                order.getQuantity(), newOwner, options.isOnChainTransfer(), options.isAutoLedgerUpdate(), duration);
            return saved;

        } catch (RuntimeException e) {
            metrics.recordOrderPhase("execute", "error");
            log.warn("Order execution failed: error={}", e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("order_execute", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    /**
     * Administrative resolution of a pending order. Requires PLATFORM.
     */
    @Transactional
    public SettlementOrder cancelOrder(String caller, String txRef, String reason) {
        MDC.put(CorrelationContext.TX_REF_MDC_KEY, txRef);
        try {
            registry.requireAnyRole(caller, Role.PLATFORM);

            SettlementOrder order = persistenceService.lockById(txRef);
            SettlementOrder cancelled = persistenceService.update(order.cancel(reason));
            publish(txRef, OrderCancelledEvent.EVENT_TYPE, OrderCancelledEvent.fromOrder(order, reason, caller));

            metrics.recordOrderPhase("cancel", "success");
            log.info("Order cancelled from {}: reason={}", order.getStatus(), reason);
            return cancelled;
        } finally {
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    /**
     * Marks a pending order FAILED, e.g. when the physical custody chain broke. Requires
     * PLATFORM or CUSTODIAN.
     */
    @Transactional
    public SettlementOrder failOrder(String caller, String txRef, String reason) {
        MDC.put(CorrelationContext.TX_REF_MDC_KEY, txRef);
        try {
            registry.requireAnyRole(caller, Role.PLATFORM, Role.CUSTODIAN);

            SettlementOrder order = persistenceService.lockById(txRef);
            SettlementOrder failed = persistenceService.update(order.fail(reason));
            publish(txRef, OrderFailedEvent.EVENT_TYPE, OrderFailedEvent.fromOrder(order, reason, caller));

            metrics.recordOrderPhase("fail", "success");
            log.info("Order failed from {}: reason={}", order.getStatus(), reason);
            return failed;
        } finally {
            MDC.remove(CorrelationContext.TX_REF_MDC_KEY);
        }
    }

    public ExecutionOptions setExecutionOptions(String caller, boolean enableOnChainTransfer,
                                                boolean enableAutoLedgerUpdate) {
        return executionOptionsService.setOptions(caller, enableOnChainTransfer, enableAutoLedgerUpdate);
    }

    public ExecutionOptions getExecutionOptions() {
        return executionOptionsService.getOptions();
    }

    @Transactional(readOnly = true)
    public SettlementOrder getOrder(String txRef) {
        return persistenceService.findById(txRef)
            .orElseThrow(() -> NotFoundException.order(txRef));
    }

    @Transactional(readOnly = true)
    public List<SettlementOrder> getOrdersByStatus(OrderStatus status) {
        return persistenceService.findByStatus(status);
    }

    private void publish(String txRef, String eventType, Object event) {
        outboxService.saveEvent(AggregateTypes.ORDER, txRef, eventType, event);
    }
}
