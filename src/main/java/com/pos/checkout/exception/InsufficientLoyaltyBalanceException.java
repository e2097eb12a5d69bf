package com.pos.checkout.exception;

/**
 * 抵扣或冻结会使客户可用积分低于零。
 */
public class InsufficientLoyaltyBalanceException extends CheckoutException {

    private final String customerId;
    private final int requested;
    private final int available;

    public InsufficientLoyaltyBalanceException(String customerId, int requested, int available) {
        super(CheckoutErrorKind.INSUFFICIENT_LOYALTY_POINTS,
                "Insufficient loyalty points for customer " + customerId
                        + ": requested " + requested + ", available " + available);
        this.customerId = customerId;
        this.requested = requested;
        this.available = available;
    }

    public String getCustomerId() {
        return customerId;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}
