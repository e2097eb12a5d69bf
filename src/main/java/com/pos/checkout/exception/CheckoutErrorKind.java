package com.pos.checkout.exception;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 对结账客户端暴露的错误分类，附带 HTTP 状态码和是否可重试。
 */
public enum CheckoutErrorKind {

    VALIDATION_ERROR("ValidationError", 400, false),
    INSUFFICIENT_INVENTORY("InsufficientInventory", 400, false),
    INSUFFICIENT_LOYALTY_POINTS("InsufficientLoyaltyPoints", 400, false),
    PAYMENT_FAILED("PaymentFailed", 402, true),
    IDEMPOTENCY_CONFLICT("IdempotencyConflict", 409, false),
    CHECKOUT_IN_PROGRESS("CheckoutInProgress", 409, true),
    ORDER_CREATION_FAILED("OrderCreationFailed", 500, true),
    INTERNAL_ERROR("InternalError", 500, true),
    GATEWAY_UNAVAILABLE("GatewayUnavailable", 503, true);

    private final String code;
    private final int httpStatus;
    private final boolean retryable;

    CheckoutErrorKind(String code, int httpStatus, boolean retryable) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean isServerError() {
        return httpStatus >= 500;
    }

    @JsonCreator
    public static CheckoutErrorKind fromCode(String code) {
        for (CheckoutErrorKind kind : values()) {
            if (kind.code.equals(code) || kind.name().equals(code)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown error kind: " + code);
    }
}
