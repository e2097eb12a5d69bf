package com.pos.checkout.dto;

import com.pos.checkout.domain.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 结账请求体
 * total = subtotal - loyaltyDiscountAmount - campaignDiscountAmount + taxAmount
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckoutRequest {
    private String idempotencyKey;
    private String vendorId;
    private String locationId;
    private String sessionId;
    private String customerId;
    private List<CheckoutItem> items;
    private BigDecimal subtotal;
    private BigDecimal taxAmount;
    private BigDecimal loyaltyDiscountAmount;
    private BigDecimal campaignDiscountAmount;
    private BigDecimal total;
    private PaymentMethod paymentMethod;
    private SplitPayment splitPayment;
    private Integer loyaltyPointsToRedeem;

    public int pointsToRedeem() {
        return loyaltyPointsToRedeem == null ? 0 : loyaltyPointsToRedeem;
    }
}
