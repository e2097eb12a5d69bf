package com.pos.checkout.exception;

public class LoyaltyAccountNotFoundException extends CheckoutException {

    public LoyaltyAccountNotFoundException(String customerId) {
        super(CheckoutErrorKind.INSUFFICIENT_LOYALTY_POINTS, "No loyalty account for customer " + customerId);
    }
}
