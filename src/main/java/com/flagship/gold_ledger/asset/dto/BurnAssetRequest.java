package com.flagship.gold_ledger.asset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * {@code account_id} is accepted for symmetry with mint; the debit always hits the mint-time account.
 */
@Value
public class BurnAssetRequest {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("reason")
    String reason;
}
