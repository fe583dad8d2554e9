package com.flagship.gold_ledger.asset.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

@Value
public class CustodyBatchRequest {

    @NotEmpty(message = "At least one token id is required")
    @JsonProperty("token_ids")
    List<Long> tokenIds;

    @NotBlank(message = "New custodian is required")
    @JsonProperty("new_custodian")
    String newCustodian;

    @JsonProperty("method")
    String method;
}
