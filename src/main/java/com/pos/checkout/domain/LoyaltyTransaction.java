package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 只追加的积分流水。balanceAfter = balanceBefore + points。
 * 更正通过新增 ADJUSTED 记录完成，从不修改已有记录。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("loyalty_transaction")
public class LoyaltyTransaction {
    private Long id;
    private String customerId;
    private LoyaltyTransactionType transactionType;
    /**
     * Signed point delta
     */
    private Integer points;
    private Integer balanceBefore;
    private Integer balanceAfter;
    private LoyaltyReferenceType referenceType;
    private String referenceId;
    private String description;
    private String traceId;
    private LocalDateTime createTime;
}
