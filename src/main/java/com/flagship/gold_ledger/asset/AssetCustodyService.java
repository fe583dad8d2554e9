package com.flagship.gold_ledger.asset;

import com.flagship.gold_ledger.asset.event.AssetBurnedEvent;
import com.flagship.gold_ledger.asset.event.AssetMintedEvent;
import com.flagship.gold_ledger.asset.event.AssetStatusChangedEvent;
import com.flagship.gold_ledger.asset.event.AssetTransferredEvent;
import com.flagship.gold_ledger.asset.event.CustodyChangedEvent;
import com.flagship.gold_ledger.asset.event.OwnershipUpdatedEvent;
import com.flagship.gold_ledger.asset.event.WarrantLinkedEvent;
import com.flagship.gold_ledger.exception.AuthorizationException;
import com.flagship.gold_ledger.exception.DuplicateException;
import com.flagship.gold_ledger.exception.NotFoundException;
import com.flagship.gold_ledger.ledger.AccountLedgerService;
import com.flagship.gold_ledger.ledger.LedgerWriteCapability;
import com.flagship.gold_ledger.member.AuthorizationRegistry;
import com.flagship.gold_ledger.member.Role;
import com.flagship.gold_ledger.observability.CorrelationContext;
import com.flagship.gold_ledger.observability.CustodyMetrics;
import com.flagship.gold_ledger.outbox.AggregateTypes;
import com.flagship.gold_ledger.outbox.OutboxService;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;

/**
 * Custody state machine for gold-bar tokens.
 *
 * Key principles:
 * - Every operation is one transaction: asset row, ledger balance and audit events commit
 *   or roll back together
 * - The asset row is locked before any transition
 * - Mint and burn move the ledger only through this service's write capability
 * - Ordinary transfers honour the custody lock; only settlement delivery bypasses it
 */
@Service
@Slf4j
public class AssetCustodyService {

    static final String MINT_REASON = "MINT";
    static final String BURN_REASON = "BURN";

    private static final Role[] MINT_ROLES = {Role.REFINER, Role.MINTER};
    private static final Role[] ASSET_OPERATOR_ROLES =
        {Role.CUSTODIAN, Role.VAULT_OPERATOR, Role.LOGISTICS_PROVIDER, Role.PLATFORM};

    private final AssetPersistenceService persistenceService;
    private final AccountLedgerService ledgerService;
    private final LedgerWriteCapability ledgerCapability;
    private final AuthorizationRegistry registry;
    private final OutboxService outboxService;
    private final CustodyMetrics metrics;

    public AssetCustodyService(AssetPersistenceService persistenceService,
                               AccountLedgerService ledgerService,
                               @Qualifier("assetCustodyLedgerCapability") LedgerWriteCapability ledgerCapability,
                               AuthorizationRegistry registry,
                               OutboxService outboxService,
                               CustodyMetrics metrics) {
        this.persistenceService = persistenceService;
        this.ledgerService = ledgerService;
        this.ledgerCapability = ledgerCapability;
        this.registry = registry;
        this.outboxService = outboxService;
        this.metrics = metrics;
    }

    /**
     * Mints a token for a physical bar and credits +1 to {@code accountId}, which becomes the
     * token's permanent ledger anchor.
     *
     * @return the new token id
     * @throws DuplicateException if the warrant was used before
     */
    @Transactional
    public long mint(String caller, String owner, String accountId, String serialNumber, String refiner,
                     long weightGrams, int fineness, String productType, String certificateHash,
                     String memberId, boolean certified, String warrantId) {
        long startTime = System.currentTimeMillis();
        try {
            registry.requireAnyRole(caller, MINT_ROLES);

            if (warrantId != null && persistenceService.warrantExists(warrantId)) {
                throw DuplicateException.warrant(warrantId);
            }

            long tokenId = persistenceService.nextTokenId();
            MDC.put(CorrelationContext.TOKEN_ID_MDC_KEY, String.valueOf(tokenId));

            GoldAsset asset = persistenceService.insert(GoldAsset.mint(tokenId, owner, accountId, serialNumber,
                refiner, weightGrams, fineness, productType, certificateHash, memberId, certified, warrantId));

            ledgerService.updateBalanceFromContract(ledgerCapability, accountId, 1, MINT_REASON,
                String.valueOf(tokenId));

            publish(tokenId, AssetMintedEvent.EVENT_TYPE, AssetMintedEvent.of(asset, caller));
            publish(tokenId, WarrantLinkedEvent.EVENT_TYPE, WarrantLinkedEvent.of(tokenId, warrantId));

            metrics.recordAssetOperation("mint", "success");
            log.info("Asset minted: serial={}, refiner={}, warrant={}, account={}, fineWeight={}g",
                serialNumber, refiner, warrantId, accountId, asset.getFineWeightGrams());
            return tokenId;

        } catch (RuntimeException e) {
            metrics.recordAssetOperation("mint", "error");
            log.warn("Mint failed: warrant={}, error={}", warrantId, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("mint", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.TOKEN_ID_MDC_KEY);
        }
    }

    /**
     * Changes the custody status. Allowed for the owner of record at the time of the call or
     * for an asset operator (custodian, vault operator, logistics provider, platform).
     */
    @Transactional
    public GoldAsset updateStatus(String caller, long tokenId, AssetStatus newStatus, String reason) {
        MDC.put(CorrelationContext.TOKEN_ID_MDC_KEY, String.valueOf(tokenId));
        try {
            Objects.requireNonNull(newStatus, "newStatus");
            GoldAsset asset = persistenceService.lockById(tokenId);

            boolean isOwner = caller != null && caller.equals(asset.getOwnerAddress());
            if (!isOwner && !registry.hasAnyRole(caller, ASSET_OPERATOR_ROLES)) {
                throw AuthorizationException.notOwner(caller, tokenId);
            }

            GoldAsset updated = persistenceService.update(asset.changeStatus(newStatus, reason));
            publish(tokenId, AssetStatusChangedEvent.EVENT_TYPE,
                AssetStatusChangedEvent.of(tokenId, asset.getStatus(), newStatus, reason, caller));

            metrics.recordAssetOperation("status", "success");
            log.info("Asset status changed: {} -> {}, reason={}", asset.getStatus(), newStatus, reason);
            return updated;
        } finally {
            MDC.remove(CorrelationContext.TOKEN_ID_MDC_KEY);
        }
    }

    /**
     * Hands a batch of bars to a new custodian; every token goes IN_TRANSIT. Any unknown or
     * burned token aborts the whole batch.
     */
    @Transactional
    public List<GoldAsset> updateCustodyBatch(String caller, List<Long> tokenIds, String newCustodian,
                                              String method) {
        registry.requireAnyRole(caller, Role.CUSTODIAN);
        if (tokenIds == null || tokenIds.isEmpty()) {
            throw new IllegalArgumentException("At least one token id is required");
        }
        if (newCustodian == null || newCustodian.isBlank()) {
            throw new IllegalArgumentException("New custodian is required");
        }

        List<GoldAsset> updated = tokenIds.stream()
            .distinct()
            .sorted()
            .map(tokenId -> moveIntoTransit(caller, tokenId, newCustodian, method))
            .toList();

        metrics.recordAssetOperation("custody", "success");
        log.info("Custody batch updated: tokens={}, newCustodian={}, method={}", tokenIds, newCustodian, method);
        return updated;
    }

    /**
     * Burns a token and debits 1 from the account recorded at mint time.
     *
     * {@code accountIdArgument} does not select the debited account; it is only logged and
     * recorded on the AssetBurned event.
     */
    @Transactional
    public GoldAsset burn(String caller, long tokenId, String accountIdArgument, String reason) {
        long startTime = System.currentTimeMillis();
        MDC.put(CorrelationContext.TOKEN_ID_MDC_KEY, String.valueOf(tokenId));
        try {
            registry.requireAnyRole(caller, MINT_ROLES);

            GoldAsset asset = persistenceService.lockById(tokenId);
            String ledgerReason = reason != null && !reason.isBlank() ? reason : BURN_REASON;
            GoldAsset burned = persistenceService.update(asset.burn(ledgerReason));

            if (accountIdArgument != null && !accountIdArgument.equals(asset.getAccountId())) {
                log.info("Burn account argument {} differs from mint-time account {}; debiting the latter",
                    accountIdArgument, asset.getAccountId());
            }
            ledgerService.updateBalanceFromContract(ledgerCapability, asset.getAccountId(), -1, ledgerReason,
                String.valueOf(tokenId));

            publish(tokenId, AssetBurnedEvent.EVENT_TYPE,
                AssetBurnedEvent.of(tokenId, asset.getAccountId(), accountIdArgument, ledgerReason, caller));

            metrics.recordAssetOperation("burn", "success");
            log.info("Asset burned: account={}, reason={}", asset.getAccountId(), ledgerReason);
            return burned;

        } catch (RuntimeException e) {
            metrics.recordAssetOperation("burn", "error");
            throw e;
        } finally {
            metrics.recordLatency("burn", System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.TOKEN_ID_MDC_KEY);
        }
    }

    /**
     * Owner-initiated transfer of a whole bar. Refused for blacklisted parties and while the
     * asset is IN_TRANSIT or PLEDGED.
     */
    @Transactional
    public GoldAsset transfer(String caller, String from, String to, long tokenId, long quantity) {
        MDC.put(CorrelationContext.TOKEN_ID_MDC_KEY, String.valueOf(tokenId));
        try {
            if (quantity != 1) {
                throw new IllegalArgumentException("A gold-bar token transfers whole; quantity must be 1: " + quantity);
            }
            if (caller == null || !caller.equals(from)) {
                throw AuthorizationException.notOwner(caller, tokenId);
            }

            GoldAsset asset = persistenceService.lockById(tokenId);
            if (!from.equals(asset.getOwnerAddress())) {
                throw AuthorizationException.notOwner(from, tokenId);
            }
            registry.requireNotBlacklisted(from, to);

            GoldAsset moved = persistenceService.update(asset.transferTo(to));

            publish(tokenId, OwnershipUpdatedEvent.EVENT_TYPE, OwnershipUpdatedEvent.of(
                tokenId, from, to, OwnershipUpdatedEvent.TAG_TRANSFER, null));
            publish(tokenId, AssetTransferredEvent.EVENT_TYPE, AssetTransferredEvent.of(tokenId, from, to, quantity));

            metrics.recordAssetOperation("transfer", "success");
            log.info("Asset transferred: from={}, to={}", from, to);
            return moved;

        } catch (RuntimeException e) {
            metrics.recordAssetOperation("transfer", "error");
            throw e;
        } finally {
            MDC.remove(CorrelationContext.TOKEN_ID_MDC_KEY);
        }
    }

    /**
     * Platform override of a compliance hold. The blacklist is skipped; the custody lock is not.
     */
    @Transactional
    public GoldAsset forceTransfer(String caller, long tokenId, String from, String to, String reason) {
        MDC.put(CorrelationContext.TOKEN_ID_MDC_KEY, String.valueOf(tokenId));
        try {
            registry.requireAnyRole(caller, Role.PLATFORM);

            GoldAsset asset = persistenceService.lockById(tokenId);
            if (!asset.getOwnerAddress().equals(from)) {
                throw new IllegalArgumentException(
                    String.format("Asset %d is owned by %s, not %s", tokenId, asset.getOwnerAddress(), from));
            }

            GoldAsset moved = persistenceService.update(asset.transferTo(to));
            publish(tokenId, OwnershipUpdatedEvent.EVENT_TYPE,
                OwnershipUpdatedEvent.of(tokenId, from, to, reason, null));

            metrics.recordAssetOperation("force_transfer", "success");
            log.info("Asset force-transferred: from={}, to={}, reason={}", from, to, reason);
            return moved;
        } finally {
            MDC.remove(CorrelationContext.TOKEN_ID_MDC_KEY);
        }
    }

    /**
     * Delivers settled tokens to the counterparty. No lock check: settlement concludes a
     * protocol both parties signed. Each token ends IN_VAULT.
     *
     * Only the order settlement service calls this, inside its own transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<GoldAsset> settleToCounterparty(List<Long> tokenIds, String newOwner, String txRef) {
        List<GoldAsset> settled = tokenIds.stream()
            .sorted()
            .map(tokenId -> {
                GoldAsset asset = persistenceService.lockById(tokenId);
                GoldAsset delivered = persistenceService.update(asset.settleTo(newOwner, "SETTLEMENT:" + txRef));

                publish(tokenId, OwnershipUpdatedEvent.EVENT_TYPE, OwnershipUpdatedEvent.of(
                    tokenId, asset.getOwnerAddress(), newOwner, OwnershipUpdatedEvent.TAG_SETTLEMENT, txRef));
                publish(tokenId, AssetStatusChangedEvent.EVENT_TYPE, AssetStatusChangedEvent.of(
                    tokenId, asset.getStatus(), AssetStatus.IN_VAULT, "SETTLEMENT:" + txRef,
                    LedgerWriteCapability.ORDER_SETTLEMENT));
                return delivered;
            })
            .toList();

        metrics.recordAssetOperation("settlement", "success");
        log.info("Settled {} token(s) to {} for order {}", settled.size(), newOwner, txRef);
        return settled;
    }

    @Transactional(readOnly = true)
    public boolean verifyCertificate(long tokenId, String hash) {
        return getAsset(tokenId).certificateMatches(hash);
    }

    @Transactional(readOnly = true)
    public boolean isAssetLocked(long tokenId) {
        return getAsset(tokenId).isLocked();
    }

    @Transactional(readOnly = true)
    public GoldAsset getAsset(long tokenId) {
        return persistenceService.findById(tokenId)
            .orElseThrow(() -> NotFoundException.asset(tokenId));
    }

    @Transactional(readOnly = true)
    public List<GoldAsset> getAssetsByOwner(String ownerAddress) {
        return persistenceService.findByOwner(ownerAddress);
    }

    private GoldAsset moveIntoTransit(String caller, long tokenId, String newCustodian, String method) {
        GoldAsset asset = persistenceService.lockById(tokenId);
        GoldAsset moved = persistenceService.update(asset.handOver(newCustodian, method));

        publish(tokenId, CustodyChangedEvent.EVENT_TYPE,
            CustodyChangedEvent.of(tokenId, asset.currentCustodian(), newCustodian, method, caller));
        return moved;
    }

    private void publish(long tokenId, String eventType, Object event) {
        outboxService.saveEvent(AggregateTypes.ASSET, String.valueOf(tokenId), eventType, event);
    }
}
