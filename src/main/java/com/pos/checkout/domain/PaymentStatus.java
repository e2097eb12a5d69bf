package com.pos.checkout.domain;

public enum PaymentStatus {
    PENDING,
    PAID,
    FAILED,
    REFUNDED,
    PARTIALLY_REFUNDED;

    public String wireValue() {
        return name().toLowerCase();
    }
}
