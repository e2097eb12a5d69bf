package com.pos.checkout.exception;

public class SessionNotFoundException extends CheckoutException {

    public SessionNotFoundException(String sessionId) {
        super(CheckoutErrorKind.INTERNAL_ERROR, "Register session not found: " + sessionId);
    }
}
