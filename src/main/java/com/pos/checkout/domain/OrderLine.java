package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("order_line")
public class OrderLine {
    private Long id;
    private String orderId;
    private String productId;
    private String productName;
    /**
     * Cart quantity, as displayed on the receipt
     */
    private Integer quantity;
    /**
     * Pricing tier label, e.g. "3.5g (Eighth)"
     */
    private String tierName;
    /**
     * Stock actually taken from inventory for the whole line
     */
    private BigDecimal quantityToDeduct;
    private BigDecimal unitPrice;
    private BigDecimal lineTotal;
    private LocalDateTime createTime;
}
