package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 某商品在某门店的现有库存计数。
 * 只在持有行锁（SELECT ... FOR UPDATE）时修改。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("inventory")
public class Inventory {
    /**
     * Primary key
     */
    private Long id;
    private String productId;
    private String locationId;
    /**
     * Physical stock in the product's stock unit (units or grams), reduced only when a reservation is finalized
     */
    private BigDecimal quantityOnHand;
    /**
     * Bumped on every counter change
     */
    private Integer version;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
