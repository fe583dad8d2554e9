package com.flagship.gold_ledger.asset;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA entity for gold-bar tokens.
 *
 * No setters: the asset attributes fixed at mint are {@code updatable = false} and only
 * owner, custodian, status and status reason change, through {@link #updateFromDomain}.
 */
@Entity
@Table(
    name = "gold_assets",
    indexes = {
        @Index(name = "idx_gold_assets_owner_address", columnList = "owner_address"),
        @Index(name = "idx_gold_assets_status", columnList = "status")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GoldAssetEntity {

    @Id
    @Column(name = "token_id", nullable = false, updatable = false)
    private Long tokenId;

    @Column(name = "serial_number", nullable = false, updatable = false)
    private String serialNumber;

    @Column(nullable = false, updatable = false)
    private String refiner;

    @Column(name = "weight_grams", nullable = false, updatable = false)
    private long weightGrams;

    @Column(nullable = false, updatable = false)
    private int fineness;

    @Column(name = "fine_weight_grams", nullable = false, updatable = false)
    private long fineWeightGrams;

    @Column(name = "product_type", updatable = false)
    private String productType;

    @Column(name = "certificate_hash", nullable = false, updatable = false)
    private String certificateHash;

    @Column(name = "member_id", nullable = false, updatable = false)
    private String memberId;

    @Column(nullable = false, updatable = false)
    private boolean certified;

    @Column(name = "warrant_id", nullable = false, unique = true, updatable = false)
    private String warrantId;

    @Column(name = "owner_address", nullable = false)
    private String ownerAddress;

    @Column
    private String custodian;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AssetStatus status;

    @Column(name = "status_reason")
    private String statusReason;

    @Column(name = "account_id", nullable = false, updatable = false)
    private String accountId;

    @Column(name = "minted_at", nullable = false, updatable = false)
    private Instant mintedAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static GoldAssetEntity fromDomain(GoldAsset asset) {
        return new GoldAssetEntity(
            asset.getTokenId(),
            asset.getSerialNumber(),
            asset.getRefiner(),
            asset.getWeightGrams(),
            asset.getFineness(),
            asset.getFineWeightGrams(),
            asset.getProductType(),
            asset.getCertificateHash(),
            asset.getMemberId(),
            asset.isCertified(),
            asset.getWarrantId(),
            asset.getOwnerAddress(),
            asset.getCustodian(),
            asset.getStatus(),
            asset.getStatusReason(),
            asset.getAccountId(),
            asset.getMintedAt(),
            asset.getUpdatedAt()
        );
    }

    public GoldAsset toDomain() {
        return new GoldAsset(
            tokenId,
            serialNumber,
            refiner,
            weightGrams,
            fineness,
            fineWeightGrams,
            productType,
            certificateHash,
            memberId,
            certified,
            warrantId,
            ownerAddress,
            custodian,
            status,
            statusReason,
            accountId,
            mintedAt,
            updatedAt
        );
    }

    /**
     * Only owner, custodian, status and status reason are mutable after mint.
     */
    void updateFromDomain(GoldAsset asset) {
        this.ownerAddress = asset.getOwnerAddress();
        this.custodian = asset.getCustodian();
        this.status = asset.getStatus();
        this.statusReason = asset.getStatusReason();
    }
}
