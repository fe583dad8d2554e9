package com.flagship.gold_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class BalanceUpdaterRequest {

    @JsonProperty("enabled")
    boolean enabled;
}
