package com.pos.checkout.domain;

public enum PaymentTransactionStatus {
    APPROVED,
    DECLINED,
    ERROR
}
