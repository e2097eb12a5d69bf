package com.pos.checkout.domain;

/**
 * 支付后失败、需要离线修复的步骤类型。
 */
public enum ReconciliationKind {
    /** Earn/spend rows were not written. */
    LOYALTY_UPDATE,
    /** Register session aggregates were not incremented. */
    SESSION_TOTALS,
    /** Reservations were not converted into a permanent deduction. */
    INVENTORY_FINALIZE,
    /** The order row could not be moved to COMPLETED/PAID. */
    ORDER_FINALIZE,
    /** The gateway never answered; a late approval must be voided. */
    PAYMENT_OUTCOME_UNKNOWN
}
