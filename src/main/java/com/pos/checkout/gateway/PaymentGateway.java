package com.pos.checkout.gateway;

/**
 * 结账视角下的银行卡处理方。
 * 实现必须遵守幂等键：相同键和金额的重复扣款返回原结果，不会再次扣款。
 */
public interface PaymentGateway {

    /**
     * Blocking charge. May take as long as a customer needs at the terminal; callers bound it.
     */
    ChargeResult charge(ChargeRequest request);

    /**
     * Outcome previously recorded for the key, or UNKNOWN when the gateway has none.
     */
    ChargeResult lookup(String idempotencyKey);

    /**
     * @return true when the capture was voided (or was already void)
     */
    boolean voidCharge(String referenceId);
}
