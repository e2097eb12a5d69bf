package com.pos.checkout.exception;

import java.math.BigDecimal;

public class InsufficientStockException extends CheckoutException {

    private final String productId;
    private final BigDecimal requested;
    private final BigDecimal available;

    public InsufficientStockException(String productId, BigDecimal requested, BigDecimal available) {
        super(CheckoutErrorKind.INSUFFICIENT_INVENTORY,
                "Insufficient inventory for product " + productId
                        + ": requested " + requested.toPlainString() + ", available " + available.toPlainString());
        this.productId = productId;
        this.requested = requested;
        this.available = available;
    }

    public String getProductId() {
        return productId;
    }

    public BigDecimal getRequested() {
        return requested;
    }

    public BigDecimal getAvailable() {
        return available;
    }
}
