package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 库存计数每次永久变更时写入的审计记录。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("stock_movement")
public class StockMovement {
    private Long id;
    private Long inventoryId;
    private String productId;
    private String locationId;
    private String orderId;
    /**
     * sale
     */
    private String movementType;
    /**
     * Signed change applied to quantityOnHand
     */
    private BigDecimal quantity;
    private BigDecimal quantityBefore;
    private BigDecimal quantityAfter;
    private String traceId;
    private LocalDateTime createTime;
}
