package com.flagship.gold_ledger.asset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_ledger.asset.AssetStatus;
import com.flagship.gold_ledger.asset.GoldAsset;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AssetResponse {

    @JsonProperty("token_id")
    long tokenId;

    @JsonProperty("serial_number")
    String serialNumber;

    @JsonProperty("refiner")
    String refiner;

    @JsonProperty("weight_grams")
    long weightGrams;

    @JsonProperty("fineness")
    int fineness;

    @JsonProperty("fine_weight_grams")
    long fineWeightGrams;

    @JsonProperty("product_type")
    String productType;

    @JsonProperty("certificate_hash")
    String certificateHash;

    @JsonProperty("member_id")
    String memberId;

    @JsonProperty("certified")
    boolean certified;

    @JsonProperty("warrant_id")
    String warrantId;

    @JsonProperty("owner")
    String owner;

    @JsonProperty("custodian")
    String custodian;

    @JsonProperty("status")
    AssetStatus status;

    @JsonProperty("status_reason")
    String statusReason;

    @JsonProperty("locked")
    boolean locked;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("minted_at")
    Instant mintedAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AssetResponse from(GoldAsset asset) {
        return AssetResponse.builder()
            .tokenId(asset.getTokenId())
            .serialNumber(asset.getSerialNumber())
            .refiner(asset.getRefiner())
            .weightGrams(asset.getWeightGrams())
            .fineness(asset.getFineness())
            .fineWeightGrams(asset.getFineWeightGrams())
            .productType(asset.getProductType())
            .certificateHash(asset.getCertificateHash())
            .memberId(asset.getMemberId())
            .certified(asset.isCertified())
            .warrantId(asset.getWarrantId())
            .owner(asset.getOwnerAddress())
            .custodian(asset.currentCustodian())
            .status(asset.getStatus())
            .statusReason(asset.getStatusReason())
            .locked(asset.isLocked())
            .accountId(asset.getAccountId())
            .mintedAt(asset.getMintedAt())
            .updatedAt(asset.getUpdatedAt())
            .build();
    }
}
