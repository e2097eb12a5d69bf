package com.pos.checkout.domain;

public enum LoyaltyHoldStatus {
    ACTIVE,
    CONSUMED,
    RELEASED,
    EXPIRED
}
