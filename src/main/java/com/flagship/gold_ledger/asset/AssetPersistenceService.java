package com.flagship.gold_ledger.asset;

import com.flagship.gold_ledger.exception.DuplicateException;
import com.flagship.gold_ledger.exception.IntegrityViolations;
import com.flagship.gold_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Bridges {@link GoldAsset} and {@link GoldAssetEntity}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AssetPersistenceService {

    private final GoldAssetRepository repository;

    @Transactional
    public long nextTokenId() {
        return repository.nextTokenId();
    }

    @Transactional(readOnly = true)
    public boolean warrantExists(String warrantId) {
        return repository.existsByWarrantId(warrantId);
    }

    /**
     * Inserts a freshly minted asset. Flushes so a concurrent mint that reused the warrant
     * fails here with {@link DuplicateException} rather than at commit.
     */
    @Transactional
    public GoldAsset insert(GoldAsset asset) {
        try {
            GoldAssetEntity saved = repository.saveAndFlush(GoldAssetEntity.fromDomain(asset));
            log.debug("Saved asset {}", saved.getTokenId());
            return saved.toDomain();
        } catch (DataIntegrityViolationException e) {
            if (IntegrityViolations.isUniqueViolation(e)) {
                throw DuplicateException.warrant(asset.getWarrantId());
            }
            throw IntegrityViolations.rejected("Asset " + asset.getTokenId(), e);
        }
    }

    /**
     * Writes the mutable fields of an existing asset.
     */
    @Transactional
    public GoldAsset update(GoldAsset asset) {
        GoldAssetEntity existing = repository.findById(asset.getTokenId())
            .orElseThrow(() -> NotFoundException.asset(asset.getTokenId()));
        existing.updateFromDomain(asset);
        GoldAssetEntity updated = repository.save(existing);
        log.debug("Updated asset {} to {}", updated.getTokenId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<GoldAsset> findById(long tokenId) {
        return repository.findById(tokenId).map(GoldAssetEntity::toDomain);
    }

    /**
     * Must run inside the caller's transaction for the lock to mean anything.
     */
    @Transactional
    public GoldAsset lockById(long tokenId) {
        return repository.findByIdForUpdate(tokenId)
            .map(GoldAssetEntity::toDomain)
            .orElseThrow(() -> NotFoundException.asset(tokenId));
    }

    @Transactional(readOnly = true)
    public List<GoldAsset> findByOwner(String ownerAddress) {
        return repository.findByOwnerAddressOrderByTokenIdAsc(ownerAddress)
            .stream()
            .map(GoldAssetEntity::toDomain)
            .toList();
    }
}
