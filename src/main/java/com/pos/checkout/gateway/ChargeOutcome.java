package com.pos.checkout.gateway;

public enum ChargeOutcome {
    APPROVED,
    DECLINED,
    /** The processor answered with an error; nothing was captured. */
    ERROR,
    /** No answer, or the gateway has no record for the key yet. */
    UNKNOWN
}
