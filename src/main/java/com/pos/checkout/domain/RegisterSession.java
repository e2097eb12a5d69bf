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
 * 已开启收银会话的累计汇总。尽力而为，可能滞后于订单。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("register_session")
public class RegisterSession {
    @TableId(type = IdType.INPUT)
    private String sessionId;
    private String locationId;
    private BigDecimal totalSales;
    private BigDecimal cashSales;
    private BigDecimal cardSales;
    private Integer transactionCount;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
