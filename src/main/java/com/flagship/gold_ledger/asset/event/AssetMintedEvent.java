package com.flagship.gold_ledger.asset.event;

import com.flagship.gold_ledger.asset.GoldAsset;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AssetMintedEvent implements AssetEvent {
    UUID eventId;
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
    String owner;
    String accountId;
    String mintedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AssetMinted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AssetMintedEvent of(GoldAsset asset, String mintedBy) {
        return new AssetMintedEvent(
            UUID.randomUUID(),
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
            asset.getOwnerAddress(),
            asset.getAccountId(),
            mintedBy,
            Instant.now()
        );
    }
}
