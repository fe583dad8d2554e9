package com.flagship.gold_ledger.order;

/**
 * ISO-4217 settlement currencies accepted on orders.
 */
public enum CurrencyCode {
    USD, // US Dollar
    EUR, // Euro
    GBP, // British Pound
    CHF, // Swiss Franc
    AED, // UAE Dirham
    INR, // Indian Rupee
    JPY, // Japanese Yen
}
