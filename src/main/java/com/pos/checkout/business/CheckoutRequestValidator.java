package com.pos.checkout.business;

import com.pos.checkout.config.CheckoutProperties;
import com.pos.checkout.domain.PaymentMethod;
import com.pos.checkout.dto.CheckoutItem;
import com.pos.checkout.dto.CheckoutRequest;
import com.pos.checkout.dto.SplitPayment;
import com.pos.checkout.exception.CheckoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;

/**
 * 在产生任何副作用之前拒绝格式错误的请求。
 * 金额校验允许配置的容差，用于兼容客户端的四舍五入。
 */
@Slf4j
@Component
public class CheckoutRequestValidator {

    /** Decimals kept by the inventory counters. */
    static final int STOCK_SCALE = 3;

    private final CheckoutProperties checkoutProperties;

    public CheckoutRequestValidator(CheckoutProperties checkoutProperties) {
        this.checkoutProperties = checkoutProperties;
    }

    /**
     * @throws CheckoutException with kind VALIDATION_ERROR on the first rule that fails
     */
    public void validate(CheckoutRequest request) {
        if (request == null) {
            throw CheckoutException.validation("Request body is required");
        }

        // ==================== 1. Identity ====================
        requireText(request.getIdempotencyKey(), "idempotencyKey");
        requireText(request.getVendorId(), "vendorId");
        requireText(request.getLocationId(), "locationId");

        // ==================== 2. Cart ====================
        if (request.getItems() == null || request.getItems().isEmpty()) {
            throw CheckoutException.validation("Cart is empty");
        }
        BigDecimal itemsTotal = BigDecimal.ZERO;
        for (CheckoutItem item : request.getItems()) {
            if (item == null || !StringUtils.hasText(item.getProductId())) {
                throw CheckoutException.validation("Every item needs a productId");
            }
            if (item.getQuantity() == null || item.getQuantity() <= 0) {
                throw CheckoutException.validation("Quantity must be positive for product " + item.getProductId());
            }
            if (item.getQuantityToDeduct() == null || item.getQuantityToDeduct().signum() <= 0) {
                // no fallback to quantity: a "28g" tier sold once must deduct 28, not 1
                throw CheckoutException.validation("quantityToDeduct must be positive for product " + item.getProductId());
            }
            if (item.getQuantityToDeduct().stripTrailingZeros().scale() > STOCK_SCALE) {
                throw CheckoutException.validation("quantityToDeduct allows at most " + STOCK_SCALE
                        + " decimals for product " + item.getProductId());
            }
            if (item.getUnitPrice() == null || item.getUnitPrice().signum() < 0) {
                throw CheckoutException.validation("Unit price must not be negative for product " + item.getProductId());
            }
            itemsTotal = itemsTotal.add(item.getUnitPrice().multiply(BigDecimal.valueOf(item.getQuantity())));
        }

        // ==================== 3. Money ====================
        BigDecimal subtotal = requireAmount(request.getSubtotal(), "subtotal");
        BigDecimal taxAmount = requireAmount(request.getTaxAmount(), "taxAmount");
        BigDecimal total = requireAmount(request.getTotal(), "total");
        BigDecimal loyaltyDiscount = optionalAmount(request.getLoyaltyDiscountAmount(), "loyaltyDiscountAmount");
        BigDecimal campaignDiscount = optionalAmount(request.getCampaignDiscountAmount(), "campaignDiscountAmount");

        if (!withinTolerance(subtotal, itemsTotal)) {
            throw CheckoutException.validation("Subtotal " + subtotal + " does not match items total " + itemsTotal);
        }
        if (total.signum() <= 0) {
            throw CheckoutException.validation("Total must be positive");
        }
        BigDecimal expectedTotal = subtotal.subtract(loyaltyDiscount).subtract(campaignDiscount).add(taxAmount);
        if (!withinTolerance(total, expectedTotal)) {
            throw CheckoutException.validation("Total " + total + " does not match expected " + expectedTotal);
        }
        if (total.compareTo(checkoutProperties.getMaxWalkInAmount()) > 0) {
            log.warn("[结账金额异常] idempotencyKey={}, total={}, threshold={}",
                    request.getIdempotencyKey(), total, checkoutProperties.getMaxWalkInAmount());
        }

        // ==================== 4. Loyalty ====================
        if (request.getLoyaltyPointsToRedeem() != null && request.getLoyaltyPointsToRedeem() < 0) {
            throw CheckoutException.validation("loyaltyPointsToRedeem must not be negative");
        }
        if (request.pointsToRedeem() > 0 && !StringUtils.hasText(request.getCustomerId())) {
            throw CheckoutException.validation("Redeeming points requires a customerId");
        }

        // ==================== 5. Tender ====================
        if (request.getPaymentMethod() == null) {
            throw CheckoutException.validation("paymentMethod is required");
        }
        if (request.getPaymentMethod() == PaymentMethod.SPLIT) {
            SplitPayment split = request.getSplitPayment();
            if (split == null) {
                throw CheckoutException.validation("Split payment requires cash and card amounts");
            }
            BigDecimal cash = requireAmount(split.getCashAmount(), "splitPayment.cashAmount");
            BigDecimal card = requireAmount(split.getCardAmount(), "splitPayment.cardAmount");
            if (!withinTolerance(cash.add(card), total)) {
                throw CheckoutException.validation("Split amounts " + cash + " + " + card + " do not add up to " + total);
            }
        }
    }

    private void requireText(String value, String field) {
        if (!StringUtils.hasText(value)) {
            throw CheckoutException.validation(field + " is required");
        }
    }

    private BigDecimal requireAmount(BigDecimal value, String field) {
        if (value == null) {
            throw CheckoutException.validation(field + " is required");
        }
        if (value.signum() < 0) {
            throw CheckoutException.validation(field + " must not be negative");
        }
        return value;
    }

    private BigDecimal optionalAmount(BigDecimal value, String field) {
        return value == null ? BigDecimal.ZERO : requireAmount(value, field);
    }

    private boolean withinTolerance(BigDecimal actual, BigDecimal expected) {
        return actual.subtract(expected).abs().compareTo(checkoutProperties.getAmountTolerance()) <= 0;
    }
}
