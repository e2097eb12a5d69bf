package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 针对库存行的限时预留。
 * 从不删除：确认为扣减、释放回库存，或被清理任务标记为过期。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("inventory_reservation")
public class InventoryReservation {
    private Long id;
    private Long inventoryId;
    private String productId;
    private String locationId;
    /**
     * Requesting order
     */
    private String orderId;
    /**
     * Held stock in the product's stock unit
     */
    private BigDecimal quantity;
    private ReservationStatus status;
    private LocalDateTime expiresAt;
    /**
     * Set when the hold stops counting against availability (finalized, released or expired)
     */
    private LocalDateTime releasedAt;
    /**
     * payment_failed, order_creation_failed, loyalty_rejected, expired, stale_order, finalized
     */
    private String releaseReason;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
