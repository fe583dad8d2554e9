package com.flagship.gold_ledger.member;

import lombok.Value;

import java.time.Instant;

/**
 * A registered participant (GIC member) of the custody network.
 */
@Value
public class Member {
    String memberId;
    String name;
    String country;
    MemberStatus status;
    Instant createdAt;
    Instant updatedAt;

    public boolean isActive() {
        return status == MemberStatus.ACTIVE;
    }
}
