package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 为处理中的积分抵扣冻结的积分。不改变余额；
 * ACTIVE 状态的冻结会减少其他结账可抵扣的积分。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("loyalty_hold")
public class LoyaltyHold {
    private Long id;
    private String customerId;
    private String orderId;
    private Integer points;
    private LoyaltyHoldStatus status;
    private LocalDateTime expiresAt;
    private LocalDateTime releasedAt;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
