package com.flagship.gold_ledger.ledger.event;

import com.flagship.gold_ledger.ledger.Account;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class AccountCreatedEvent implements LedgerEvent {
    UUID eventId;
    String accountId;
    String memberId;
    String address;
    String createdBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AccountCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static AccountCreatedEvent of(Account account, String createdBy) {
        return new AccountCreatedEvent(
            UUID.randomUUID(),
            account.getAccountId(),
            account.getMemberId(),
            account.getAddress(),
            createdBy,
            Instant.now()
        );
    }
}
