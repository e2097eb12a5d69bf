package com.pos.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * 拆分支付明细。只有 cardAmount 会提交给网关。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SplitPayment {
    private BigDecimal cashAmount;
    private BigDecimal cardAmount;
}
