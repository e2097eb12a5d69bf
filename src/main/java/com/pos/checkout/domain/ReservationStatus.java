package com.pos.checkout.domain;

/**
 * ACTIVE 状态的预留无论是否超过 expiresAt 都计入占用。
 */
public enum ReservationStatus {
    ACTIVE,
    FINALIZED,
    RELEASED,
    EXPIRED
}
