package com.flagship.gold_ledger.exception;

/**
 * Raised when a globally unique identifier is reused.
 */
public class DuplicateException extends GoldLedgerException {

    public static final String WARRANT_ALREADY_USED = "WARRANT_ALREADY_USED";
    public static final String TX_REF_ALREADY_USED = "TX_REF_ALREADY_USED";
    public static final String MEMBER_ALREADY_EXISTS = "MEMBER_ALREADY_EXISTS";

    public DuplicateException(String code, String message) {
        super(code, message);
    }

    public static DuplicateException warrant(String warrantId) {
        return new DuplicateException(WARRANT_ALREADY_USED, "Warrant already used: " + warrantId);
    }

    public static DuplicateException txRef(String txRef) {
        return new DuplicateException(TX_REF_ALREADY_USED, "Transaction reference already used: " + txRef);
    }

    public static DuplicateException member(String memberId) {
        return new DuplicateException(MEMBER_ALREADY_EXISTS, "Member already registered: " + memberId);
    }
}
