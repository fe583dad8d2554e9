package com.flagship.gold_ledger.exception;

import com.flagship.gold_ledger.member.MemberStatus;

public class MemberNotActiveException extends GoldLedgerException {

    public static final String MEMBER_NOT_ACTIVE = "MEMBER_NOT_ACTIVE";

    public MemberNotActiveException(String memberId, MemberStatus status) {
        super(MEMBER_NOT_ACTIVE, String.format("Member %s is %s, expected ACTIVE", memberId, status));
    }

    private MemberNotActiveException(String message) {
        super(MEMBER_NOT_ACTIVE, message);
    }

    public static MemberNotActiveException unregistered(String memberId) {
        return new MemberNotActiveException(String.format("Member %s is not registered, expected ACTIVE", memberId));
    }
}
