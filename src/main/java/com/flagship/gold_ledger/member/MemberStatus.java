package com.flagship.gold_ledger.member;

public enum MemberStatus {
    PENDING,
    ACTIVE,
    SUSPENDED,
    TERMINATED
}
