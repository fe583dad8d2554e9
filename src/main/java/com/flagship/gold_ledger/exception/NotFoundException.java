package com.flagship.gold_ledger.exception;

/**
 * Raised when an account, asset, order or member is unknown.
 */
public class NotFoundException extends GoldLedgerException {

    public static final String ACCOUNT_NOT_FOUND = "ACCOUNT_NOT_FOUND";
    public static final String ASSET_NOT_FOUND = "ASSET_NOT_FOUND";
    public static final String ORDER_NOT_FOUND = "ORDER_NOT_FOUND";
    public static final String MEMBER_NOT_FOUND = "MEMBER_NOT_FOUND";

    public NotFoundException(String code, String message) {
        super(code, message);
    }

    public static NotFoundException account(String accountId) {
        return new NotFoundException(ACCOUNT_NOT_FOUND, "Account not found: " + accountId);
    }

    public static NotFoundException asset(long tokenId) {
        return new NotFoundException(ASSET_NOT_FOUND, "Asset not found: " + tokenId);
    }

    public static NotFoundException order(String txRef) {
        return new NotFoundException(ORDER_NOT_FOUND, "Order not found: " + txRef);
    }

    public static NotFoundException member(String memberId) {
        return new NotFoundException(MEMBER_NOT_FOUND, "Member not found: " + memberId);
    }
}
