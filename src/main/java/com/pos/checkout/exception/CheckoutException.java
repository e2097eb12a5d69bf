package com.pos.checkout.exception;

/**
 * 结账异常基类。kind 决定 HTTP 状态码以及客户端能否重试。
 */
public class CheckoutException extends RuntimeException {

    private final CheckoutErrorKind kind;

    public CheckoutException(CheckoutErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CheckoutException(CheckoutErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public CheckoutErrorKind getKind() {
        return kind;
    }

    public static CheckoutException validation(String message) {
        return new CheckoutException(CheckoutErrorKind.VALIDATION_ERROR, message);
    }
}
