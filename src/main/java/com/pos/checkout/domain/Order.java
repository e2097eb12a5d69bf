package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 一次结账尝试
 * - 与库存预留在同一事务中创建为 PENDING/PENDING 草稿
 * - 编排器返回前完结为 COMPLETED/PAID 或 CANCELLED/FAILED
 * - COMPLETED 之后不可修改
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("orders")
public class Order {

    /**
     * Primary key (UUID)
     */
    @TableId(type = IdType.INPUT)
    private String id;

    /**
     * Human readable number, ORD-{millis}-{suffix}
     */
    private String orderNumber;

    /**
     * Client supplied idempotency key (unique)
     */
    private String idempotencyKey;

    /**
     * Digest of the request body, used to detect key reuse with a different payload
     */
    private String requestFingerprint;

    private String vendorId;

    private String locationId;

    private String sessionId;

    private String customerId;

    private OrderStatus status;

    private PaymentStatus paymentStatus;

    private PaymentMethod paymentMethod;

    private BigDecimal subtotal;

    private BigDecimal taxAmount;

    private BigDecimal loyaltyDiscountAmount;

    private BigDecimal campaignDiscountAmount;

    /**
     * loyaltyDiscountAmount + campaignDiscountAmount
     */
    private BigDecimal discountAmount;

    private BigDecimal total;

    private Integer loyaltyPointsRedeemed;

    private Integer loyaltyPointsEarned;

    /**
     * Serialized CheckoutResult returned on idempotent replay
     */
    private String resultPayload;

    private String traceId;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;

    public boolean isResolved() {
        return status != null && status != OrderStatus.PENDING;
    }
}
