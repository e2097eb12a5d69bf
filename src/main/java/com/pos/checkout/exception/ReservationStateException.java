package com.pos.checkout.exception;

/**
 * 预留已无法确认时抛出：不存在、已被释放、被并发关闭，或现有库存不足以扣减预留数量。
 */
public class ReservationStateException extends CheckoutException {

    public ReservationStateException(String message) {
        super(CheckoutErrorKind.INTERNAL_ERROR, message);
    }
}
