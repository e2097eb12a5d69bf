package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 标记订单已计入某会话汇总（会话与订单唯一）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("session_payment")
public class SessionPayment {
    private Long id;
    private String sessionId;
    private String orderId;
    private BigDecimal cashAmount;
    private BigDecimal cardAmount;
    private LocalDateTime createTime;
}
