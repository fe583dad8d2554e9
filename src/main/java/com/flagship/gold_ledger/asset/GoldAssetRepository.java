package com.flagship.gold_ledger.asset;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface GoldAssetRepository extends JpaRepository<GoldAssetEntity, Long> {

    @Query(value = "SELECT nextval('gold_asset_token_seq')", nativeQuery = true)
    long nextTokenId();

    boolean existsByWarrantId(String warrantId);

    /**
     * Owner to token index.
     */
    List<GoldAssetEntity> findByOwnerAddressOrderByTokenIdAsc(String ownerAddress);

    /**
     * Loads an asset with a row lock so concurrent transitions on one token serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM GoldAssetEntity a WHERE a.tokenId = :tokenId")
    Optional<GoldAssetEntity> findByIdForUpdate(@Param("tokenId") Long tokenId);
}
