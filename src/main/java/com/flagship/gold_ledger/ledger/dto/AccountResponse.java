package com.flagship.gold_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gold_ledger.ledger.Account;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("member_id")
    String memberId;

    @JsonProperty("address")
    String address;

    @JsonProperty("balance")
    long balance;

    @JsonProperty("last_reason")
    String lastReason;

    @JsonProperty("last_reference")
    String lastReference;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .accountId(account.getAccountId())
            .memberId(account.getMemberId())
            .address(account.getAddress())
            .balance(account.getBalance())
            .lastReason(account.getLastReason())
            .lastReference(account.getLastReference())
            .createdAt(account.getCreatedAt())
            .updatedAt(account.getUpdatedAt())
            .build();
    }
}
