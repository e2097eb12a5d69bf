package com.pos.checkout.domain;

public enum LoyaltyTransactionType {
    EARNED,
    SPENT,
    ADJUSTED
}
