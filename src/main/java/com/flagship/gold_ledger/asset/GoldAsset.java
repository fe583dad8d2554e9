package com.flagship.gold_ledger.asset;

import com.flagship.gold_ledger.exception.InvalidStateException;
import lombok.Value;

import java.time.Instant;

/**
 * Gold-bar token domain object.
 *
 * Immutable: every transition returns a new instance. The mint-time account id and the
 * warrant id never change after mint.
 */
@Value
public class GoldAsset {

    public static final int MAX_FINENESS = 10_000;

    long tokenId;
    String serialNumber;
    String refiner;
    long weightGrams;
    int fineness;
    long fineWeightGrams;
    String productType;
    String certificateHash;
    String memberId;
    boolean certified;
    String warrantId;
    String ownerAddress;
    String custodian;
    AssetStatus status;
    String statusReason;
    String accountId;
    Instant mintedAt;
    Instant updatedAt;

    /**
     * Creates a newly minted asset in REGISTERED status.
     *
     * @throws IllegalArgumentException if weight or fineness are out of range or a
     *         required attribute is missing
     */
    public static GoldAsset mint(long tokenId, String owner, String accountId, String serialNumber,
                                 String refiner, long weightGrams, int fineness, String productType,
                                 String certificateHash, String memberId, boolean certified,
                                 String warrantId) {
        requireText(owner, "owner");
        requireText(accountId, "accountId");
        requireText(serialNumber, "serialNumber");
        requireText(refiner, "refiner");
        requireText(certificateHash, "certificateHash");
        requireText(memberId, "memberId");
        requireText(warrantId, "warrantId");
        if (weightGrams <= 0) {
            throw new IllegalArgumentException("Weight must be positive: " + weightGrams);
        }
        if (fineness < 1 || fineness > MAX_FINENESS) {
            throw new IllegalArgumentException("Fineness must be between 1 and " + MAX_FINENESS + ": " + fineness);
        }

        Instant now = Instant.now();
        return new GoldAsset(
            tokenId,
            serialNumber,
            refiner,
            weightGrams,
            fineness,
            fineWeight(weightGrams, fineness),
            productType,
            certificateHash,
            memberId,
            certified,
            warrantId,
            owner,
            null,
            AssetStatus.REGISTERED,
            null,
            accountId,
            now,
            now
        );
    }

    /**
     * Fine weight in grams, truncated: weight x fineness / 10,000.
     */
    public static long fineWeight(long weightGrams, int fineness) {
        return Math.multiplyExact(weightGrams, (long) fineness) / MAX_FINENESS;
    }

    public boolean isLocked() {
        return status.isLocked();
    }

    public boolean isBurned() {
        return status == AssetStatus.BURNED;
    }

    /**
     * Moves to a non-terminal status. BURNED is only reachable through {@link #burn}.
     */
    public GoldAsset changeStatus(AssetStatus newStatus, String reason) {
        requireNotBurned();
        if (newStatus == AssetStatus.BURNED) {
            throw new InvalidStateException(InvalidStateException.ASSET_BURNED,
                String.format("Asset %d can only be burned through burn", tokenId));
        }
        return withOwnerAndStatus(ownerAddress, newStatus, reason);
    }

    /**
     * Custody handoff: records the new custodian and puts the bar IN_TRANSIT.
     */
    public GoldAsset handOver(String newCustodian, String method) {
        requireText(newCustodian, "newCustodian");
        requireNotBurned();
        return copy(ownerAddress, newCustodian, AssetStatus.IN_TRANSIT, "CUSTODY:" + method);
    }

    /**
     * Who physically holds the bar: the last custodian handed to, or the owner of record
     * before any handoff.
     */
    public String currentCustodian() {
        return custodian != null ? custodian : ownerAddress;
    }

    public GoldAsset burn(String reason) {
        requireNotBurned();
        return withOwnerAndStatus(ownerAddress, AssetStatus.BURNED, reason);
    }

    /**
     * Ordinary ownership transfer; refused while the asset is under a custody lock.
     */
    public GoldAsset transferTo(String newOwner) {
        requireText(newOwner, "newOwner");
        requireNotBurned();
        if (isLocked()) {
            throw new InvalidStateException(InvalidStateException.ASSET_LOCKED,
                String.format("Asset %d is locked in %s status", tokenId, status));
        }
        return withOwnerAndStatus(newOwner, status, statusReason);
    }

    /**
     * Settlement delivery: moves ownership regardless of the custody lock and places the
     * asset IN_VAULT on the receiving side.
     */
    public GoldAsset settleTo(String newOwner, String reason) {
        requireText(newOwner, "newOwner");
        requireNotBurned();
        return withOwnerAndStatus(newOwner, AssetStatus.IN_VAULT, reason);
    }

    public boolean certificateMatches(String hash) {
        return certificateHash.equals(hash);
    }

    private void requireNotBurned() {
        if (isBurned()) {
            throw new InvalidStateException(InvalidStateException.ASSET_BURNED,
                String.format("Asset %d is burned", tokenId));
        }
    }

    private GoldAsset withOwnerAndStatus(String owner, AssetStatus newStatus, String reason) {
        return copy(owner, custodian, newStatus, reason);
    }

    private GoldAsset copy(String owner, String newCustodian, AssetStatus newStatus, String reason) {
        return new GoldAsset(
            this.tokenId,
            this.serialNumber,
            this.refiner,
            this.weightGrams,
            this.fineness,
            this.fineWeightGrams,
            this.productType,
            this.certificateHash,
            this.memberId,
            this.certified,
            this.warrantId,
            owner,
            newCustodian,
            newStatus,
            reason,
            this.accountId,
            this.mintedAt,
            Instant.now()
        );
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
