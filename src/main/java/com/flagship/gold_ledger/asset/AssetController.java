package com.flagship.gold_ledger.asset;

import com.flagship.gold_ledger.asset.dto.AssetResponse;
import com.flagship.gold_ledger.asset.dto.BurnAssetRequest;
import com.flagship.gold_ledger.asset.dto.CustodyBatchRequest;
import com.flagship.gold_ledger.asset.dto.MintAssetRequest;
import com.flagship.gold_ledger.asset.dto.TransferAssetRequest;
import com.flagship.gold_ledger.asset.dto.UpdateStatusRequest;
import com.flagship.gold_ledger.observability.CorrelationContext;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for gold-bar tokens.
 */
@RestController
@RequestMapping("/api/assets")
@RequiredArgsConstructor
@Slf4j
public class AssetController {

    private static final String CALLER_HEADER = CorrelationContext.CALLER_HEADER;

    private final AssetCustodyService custodyService;

    @PostMapping
    public ResponseEntity<AssetResponse> mint(
            @Valid @RequestBody MintAssetRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        log.info("Received mint request: serial={}, refiner={}, warrant={}",
                request.getSerialNumber(), request.getRefiner(), request.getWarrantId());
        long tokenId = custodyService.mint(
            caller,
            request.getOwner(),
            request.getAccountId(),
            request.getSerialNumber(),
            request.getRefiner(),
            request.getWeightGrams(),
            request.getFineness(),
            request.getProductType(),
            request.getCertificateHash(),
            request.getMemberId(),
            request.isCertified(),
            request.getWarrantId()
        );
        return ResponseEntity.status(HttpStatus.CREATED)
            .body(AssetResponse.from(custodyService.getAsset(tokenId)));
    }

    @GetMapping("/{tokenId}")
    public ResponseEntity<AssetResponse> getAsset(@PathVariable("tokenId") long tokenId) {
        return ResponseEntity.ok(AssetResponse.from(custodyService.getAsset(tokenId)));
    }

    @GetMapping
    public ResponseEntity<List<AssetResponse>> getAssetsByOwner(@RequestParam("owner") String owner) {
        return ResponseEntity.ok(custodyService.getAssetsByOwner(owner).stream()
            .map(AssetResponse::from)
            .toList());
    }

    @GetMapping("/{tokenId}/locked")
    public ResponseEntity<Map<String, Object>> isLocked(@PathVariable("tokenId") long tokenId) {
        return ResponseEntity.ok(Map.of("token_id", tokenId, "locked", custodyService.isAssetLocked(tokenId)));
    }

    @GetMapping("/{tokenId}/certificate")
    public ResponseEntity<Map<String, Object>> verifyCertificate(
            @PathVariable("tokenId") long tokenId,
            @RequestParam("hash") String hash) {
        return ResponseEntity.ok(Map.of("token_id", tokenId, "valid", custodyService.verifyCertificate(tokenId, hash)));
    }

    @PutMapping("/{tokenId}/status")
    public ResponseEntity<AssetResponse> updateStatus(
            @PathVariable("tokenId") long tokenId,
            @Valid @RequestBody UpdateStatusRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        GoldAsset asset = custodyService.updateStatus(caller, tokenId, request.getStatus(), request.getReason());
        return ResponseEntity.ok(AssetResponse.from(asset));
    }

    @PostMapping("/custody")
    public ResponseEntity<List<AssetResponse>> updateCustodyBatch(
            @Valid @RequestBody CustodyBatchRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        List<GoldAsset> assets = custodyService.updateCustodyBatch(
            caller, request.getTokenIds(), request.getNewCustodian(), request.getMethod());
        return ResponseEntity.ok(assets.stream().map(AssetResponse::from).toList());
    }

    @PostMapping("/{tokenId}/burn")
    public ResponseEntity<AssetResponse> burn(
            @PathVariable("tokenId") long tokenId,
            @RequestBody BurnAssetRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        GoldAsset asset = custodyService.burn(caller, tokenId, request.getAccountId(), request.getReason());
        return ResponseEntity.ok(AssetResponse.from(asset));
    }

    @PostMapping("/{tokenId}/transfer")
    public ResponseEntity<AssetResponse> transfer(
            @PathVariable("tokenId") long tokenId,
            @Valid @RequestBody TransferAssetRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        long quantity = request.getQuantity() != null ? request.getQuantity() : 1;
        GoldAsset asset = custodyService.transfer(caller, request.getFrom(), request.getTo(), tokenId, quantity);
        return ResponseEntity.ok(AssetResponse.from(asset));
    }

    @PostMapping("/{tokenId}/force-transfer")
    public ResponseEntity<AssetResponse> forceTransfer(
            @PathVariable("tokenId") long tokenId,
            @Valid @RequestBody TransferAssetRequest request,
            @RequestHeader(CALLER_HEADER) String caller) {
        GoldAsset asset = custodyService.forceTransfer(
            caller, tokenId, request.getFrom(), request.getTo(), request.getReason());
        return ResponseEntity.ok(AssetResponse.from(asset));
    }
}
