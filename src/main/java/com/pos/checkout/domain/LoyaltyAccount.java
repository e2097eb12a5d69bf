package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 客户积分余额，等于该客户所有 loyalty_transaction 积分之和。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("loyalty_account")
public class LoyaltyAccount {
    private Long id;
    private String customerId;
    private Integer pointsBalance;
    private Integer version;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
