package com.pos.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 人工积分调整。负数表示扣除积分。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LoyaltyAdjustmentRequest {
    private Integer points;
    /**
     * Operator ticket or reason code
     */
    private String referenceId;
}
