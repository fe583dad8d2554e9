package com.flagship.gold_ledger.exception;

public class ComplianceException extends GoldLedgerException {

    public static final String ADDRESS_BLACKLISTED = "ADDRESS_BLACKLISTED";

    public ComplianceException(String address) {
        super(ADDRESS_BLACKLISTED, "Address is blacklisted: " + address);
    }
}
