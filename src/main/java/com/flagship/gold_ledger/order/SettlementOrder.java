package com.flagship.gold_ledger.order;

import com.flagship.gold_ledger.exception.InvalidStateException;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Bilateral settlement instruction.
 *
 * Key principles:
 * - Status transitions are explicit and one-way
 * - A transition from the wrong phase raises {@link InvalidStateException}
 * - State changes are immutable (each transition returns a new order)
 *
 * The order never holds balances or token attributes; it only names the accounts and
 * tokens that execution will move.
 */
@Value
public class SettlementOrder {
    String txRef;
    String externalRef;
    OrderType type;
    String initiatorId;
    String counterpartyId;
    String sourceAccountId;
    String destAccountId;
    List<Long> tokenIds;
    List<String> requestedAssets;
    int quantity;
    LocalDate settlementDate;
    CurrencyCode currency;
    BigDecimal price;
    BigDecimal fee;
    String metadata;
    OrderStatus status;
    String signature;
    String signerAddress;
    String signerParty;
    Instant signedAt;
    Instant executedAt;
    String closingReason;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates an order in PENDING_COUNTERPARTY. Quantity is the number of tokens.
     */
    public static SettlementOrder prepare(String txRef, String externalRef, OrderType type,
                                          String initiatorId, String counterpartyId,
                                          String sourceAccountId, String destAccountId,
                                          List<Long> tokenIds, List<String> requestedAssets,
                                          LocalDate settlementDate, CurrencyCode currency,
                                          BigDecimal price, BigDecimal fee, String metadata) {
        requireText(txRef, "txRef");
        requireText(initiatorId, "initiatorId");
        requireText(counterpartyId, "counterpartyId");
        requireText(sourceAccountId, "sourceAccountId");
        requireText(destAccountId, "destAccountId");
        if (type == null) {
            throw new IllegalArgumentException("Order type is required");
        }
        List<Long> tokens = tokenIds != null ? List.copyOf(tokenIds) : List.of();
        List<String> requested = requestedAssets != null ? List.copyOf(requestedAssets) : List.of();
        if (tokens.isEmpty() && requested.isEmpty()) {
            throw new IllegalArgumentException("Order must name at least one token or requested asset");
        }
        if (tokens.stream().distinct().count() != tokens.size()) {
            throw new IllegalArgumentException("Order lists the same token more than once");
        }
        if (sourceAccountId.equals(destAccountId)) {
            throw new IllegalArgumentException("Source and destination accounts must be different");
        }
        if (price != null && price.signum() < 0) {
            throw new IllegalArgumentException("Price cannot be negative");
        }
        if (fee != null && fee.signum() < 0) {
            throw new IllegalArgumentException("Fee cannot be negative");
        }

        Instant now = Instant.now();
        return new SettlementOrder(
            txRef, externalRef, type, initiatorId, counterpartyId, sourceAccountId, destAccountId,
            tokens, requested, tokens.size(), settlementDate, currency, price, fee, metadata,
            OrderStatus.PENDING_COUNTERPARTY,
            null, null, null, null, null, null,
            now, now
        );
    }

    /**
     * Records the counterparty signature. Only valid from PENDING_COUNTERPARTY.
     */
    public SettlementOrder sign(String signatureHex, String signer, String party) {
        requireStatus(OrderStatus.PENDING_COUNTERPARTY, "sign");
        Instant now = Instant.now();
        return new SettlementOrder(
            txRef, externalRef, type, initiatorId, counterpartyId, sourceAccountId, destAccountId,
            tokenIds, requestedAssets, quantity, settlementDate, currency, price, fee, metadata,
            OrderStatus.PENDING_EXECUTION,
            signatureHex, signer, party, now, null, null,
            createdAt, now
        );
    }

    /**
     * Only valid from PENDING_EXECUTION, so a second execution of the same order fails.
     */
    public SettlementOrder execute() {
        requireStatus(OrderStatus.PENDING_EXECUTION, "execute");
        Instant now = Instant.now();
        return new SettlementOrder(
            txRef, externalRef, type, initiatorId, counterpartyId, sourceAccountId, destAccountId,
            tokenIds, requestedAssets, quantity, settlementDate, currency, price, fee, metadata,
            OrderStatus.EXECUTED,
            signature, signerAddress, signerParty, signedAt, now, null,
            createdAt, now
        );
    }

    public SettlementOrder cancel(String reason) {
        return close(OrderStatus.CANCELLED, reason, "cancel");
    }

    public SettlementOrder fail(String reason) {
        return close(OrderStatus.FAILED, reason, "fail");
    }

    public boolean canTransitionTo(OrderStatus target) {
        return switch (status) {
            case PENDING_COUNTERPARTY -> target == OrderStatus.PENDING_EXECUTION
                || target == OrderStatus.CANCELLED || target == OrderStatus.FAILED;
            case PENDING_EXECUTION -> target == OrderStatus.EXECUTED
                || target == OrderStatus.CANCELLED || target == OrderStatus.FAILED;
            case EXECUTED, CANCELLED, FAILED -> false;
        };
    }

    private SettlementOrder close(OrderStatus target, String reason, String action) {
        if (!canTransitionTo(target)) {
            throw invalidState(action);
        }
        return new SettlementOrder(
            txRef, externalRef, type, initiatorId, counterpartyId, sourceAccountId, destAccountId,
            tokenIds, requestedAssets, quantity, settlementDate, currency, price, fee, metadata,
            target,
            signature, signerAddress, signerParty, signedAt, null, reason,
            createdAt, Instant.now()
        );
    }

    private void requireStatus(OrderStatus expected, String action) {
        if (status != expected) {
            throw invalidState(action);
        }
    }

    private InvalidStateException invalidState(String action) {
        return new InvalidStateException(InvalidStateException.INVALID_ORDER_STATE,
            String.format("Cannot %s order %s in %s status", action, txRef, status));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
