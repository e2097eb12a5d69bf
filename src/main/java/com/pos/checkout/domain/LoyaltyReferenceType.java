package com.pos.checkout.domain;

public enum LoyaltyReferenceType {
    ORDER,
    MANUAL
}
