package com.flagship.gold_ledger.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * A member's gold account. The balance is a current value, never negative, and only moves
 * through {@link AccountLedgerService}.
 */
@Value
public class Account {
    String accountId;
    String memberId;
    String address;
    long balance;
    String lastReason;
    String lastReference;
    Instant createdAt;
    Instant updatedAt;
}
