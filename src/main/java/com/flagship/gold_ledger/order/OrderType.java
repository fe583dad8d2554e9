package com.flagship.gold_ledger.order;

public enum OrderType {
    TRANSFER,
    SALE,
    PURCHASE,
    SWAP
}
