package com.pos.checkout.exception;

public class PaymentGatewayException extends CheckoutException {

    public PaymentGatewayException(String message) {
        super(CheckoutErrorKind.GATEWAY_UNAVAILABLE, message);
    }

    public PaymentGatewayException(String message, Throwable cause) {
        super(CheckoutErrorKind.GATEWAY_UNAVAILABLE, message, cause);
    }
}
