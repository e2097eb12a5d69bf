package com.pos.checkout.domain;

/**
 * 订单生命周期：创建时为 PENDING，结账返回前完结为 COMPLETED 或 CANCELLED。
 */
public enum OrderStatus {
    PENDING,
    COMPLETED,
    CANCELLED;

    public String wireValue() {
        return name().toLowerCase();
    }
}
