package com.pos.checkout.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.pos.checkout.domain.Order;
import com.pos.checkout.exception.CheckoutErrorKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * 一次结账的响应。要么填充成功字段，要么填充 errorKind/message/retryable。
 * 保存在订单上，重放时返回完全相同的值。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckoutResult {

    private static final String SANITIZED_MESSAGE = "Checkout could not be completed. Reference: ";

    private String orderId;
    private String orderNumber;
    private String status;
    private String paymentStatus;
    private BigDecimal total;
    private Integer pointsEarned;
    private Integer pointsRedeemed;

    private CheckoutErrorKind errorKind;
    private String message;
    private Boolean retryable;

    @JsonIgnore
    public boolean isSuccess() {
        return errorKind == null;
    }

    @JsonIgnore
    public int httpStatus() {
        return errorKind == null ? 200 : errorKind.getHttpStatus();
    }

    public static CheckoutResult completed(Order order) {
        return CheckoutResult.builder()
                .orderId(order.getId())
                .orderNumber(order.getOrderNumber())
                .status(order.getStatus().wireValue())
                .paymentStatus(order.getPaymentStatus().wireValue())
                .total(order.getTotal().setScale(2, RoundingMode.HALF_UP))
                .pointsEarned(order.getLoyaltyPointsEarned())
                .pointsRedeemed(order.getLoyaltyPointsRedeemed())
                .build();
    }

    /**
     * Server-side failures never leak internals; the client gets a reference to quote instead.
     */
    public static CheckoutResult failure(CheckoutErrorKind kind, String message, String reference) {
        String visibleMessage = kind.isServerError() ? SANITIZED_MESSAGE + reference : message;
        return CheckoutResult.builder()
                .errorKind(kind)
                .message(visibleMessage)
                .retryable(kind.isRetryable())
                .build();
    }
}
