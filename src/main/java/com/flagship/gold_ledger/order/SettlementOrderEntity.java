package com.flagship.gold_ledger.order;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.domain.Persistable;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity for settlement orders.
 *
 * The tx reference is the primary key, so a reused reference cannot be inserted twice even
 * if the application-level check races. Instruction fields are {@code updatable = false};
 * only the lifecycle fields change through {@link #updateFromDomain}.
 *
 * Implements {@link Persistable} so a new order is always persisted, never merged: a merge
 * would silently overwrite an existing order carrying the same reference.
 */
@Entity
@Table(
    name = "settlement_orders",
    indexes = {
        @Index(name = "idx_settlement_orders_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class SettlementOrderEntity implements Persistable<String> {

    @Id
    @Column(name = "tx_ref", nullable = false, updatable = false)
    private String txRef;

    @Column(name = "external_ref", updatable = false)
    private String externalRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "order_type", nullable = false, updatable = false)
    private OrderType type;

    @Column(name = "initiator_id", nullable = false, updatable = false)
    private String initiatorId;

    @Column(name = "counterparty_id", nullable = false, updatable = false)
    private String counterpartyId;

    @Column(name = "source_account_id", nullable = false, updatable = false)
    private String sourceAccountId;

    @Column(name = "dest_account_id", nullable = false, updatable = false)
    private String destAccountId;

    @ElementCollection
    @CollectionTable(name = "settlement_order_tokens", joinColumns = @JoinColumn(name = "tx_ref"))
    @OrderColumn(name = "token_index")
    @Column(name = "token_id", nullable = false)
    private List<Long> tokenIds = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "settlement_order_requested_assets", joinColumns = @JoinColumn(name = "tx_ref"))
    @OrderColumn(name = "asset_index")
    @Column(name = "descriptor", nullable = false)
    private List<String> requestedAssets = new ArrayList<>();

    @Column(nullable = false, updatable = false)
    private int quantity;

    @Column(name = "settlement_date", updatable = false)
    private LocalDate settlementDate;

    @Enumerated(EnumType.STRING)
    @Column(length = 3, updatable = false)
    private CurrencyCode currency;

    @Column(precision = 19, scale = 4, updatable = false)
    private BigDecimal price;

    @Column(precision = 19, scale = 4, updatable = false)
    private BigDecimal fee;

    @Column(updatable = false)
    private String metadata;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus status;

    @Column
    private String signature;

    @Column(name = "signer_address")
    private String signerAddress;

    @Column(name = "signer_party")
    private String signerParty;

    @Column(name = "signed_at")
    private Instant signedAt;

    @Column(name = "executed_at")
    private Instant executedAt;

    @Column(name = "closing_reason")
    private String closingReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Transient
    private boolean isNew;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    @PostLoad
    @PostPersist
    void markNotNew() {
        this.isNew = false;
    }

    @Override
    public String getId() {
        return txRef;
    }

    @Override
    public boolean isNew() {
        return isNew;
    }

    static SettlementOrderEntity fromDomain(SettlementOrder order) {
        return new SettlementOrderEntity(
            order.getTxRef(),
            order.getExternalRef(),
            order.getType(),
            order.getInitiatorId(),
            order.getCounterpartyId(),
            order.getSourceAccountId(),
            order.getDestAccountId(),
            new ArrayList<>(order.getTokenIds()),
            new ArrayList<>(order.getRequestedAssets()),
            order.getQuantity(),
            order.getSettlementDate(),
            order.getCurrency(),
            order.getPrice(),
            order.getFee(),
            order.getMetadata(),
            order.getStatus(),
            order.getSignature(),
            order.getSignerAddress(),
            order.getSignerParty(),
            order.getSignedAt(),
            order.getExecutedAt(),
            order.getClosingReason(),
            order.getCreatedAt(),
            order.getUpdatedAt(),
            true
        );
    }

    public SettlementOrder toDomain() {
        return new SettlementOrder(
            txRef,
            externalRef,
            type,
            initiatorId,
            counterpartyId,
            sourceAccountId,
            destAccountId,
            List.copyOf(tokenIds),
            List.copyOf(requestedAssets),
            quantity,
            settlementDate,
            currency,
            price,
            fee,
            metadata,
            status,
            signature,
            signerAddress,
            signerParty,
            signedAt,
            executedAt,
            closingReason,
            createdAt,
            updatedAt
        );
    }

    /**
     * Only lifecycle fields are mutable; the instruction itself is fixed at prepare time.
     */
    void updateFromDomain(SettlementOrder order) {
        this.status = order.getStatus();
        this.signature = order.getSignature();
        this.signerAddress = order.getSignerAddress();
        this.signerParty = order.getSignerParty();
        this.signedAt = order.getSignedAt();
        this.executedAt = order.getExecutedAt();
        this.closingReason = order.getClosingReason();
    }
}
