package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 一次支付尝试。拆分支付会产生一条 CASH 记录和一条 CARD 记录。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("payment_transaction")
public class PaymentTransaction {
    private Long id;
    private String orderId;
    /**
     * CASH or CARD, never SPLIT
     */
    private PaymentMethod paymentMethod;
    private BigDecimal amount;
    private PaymentTransactionStatus status;
    private String processorReferenceId;
    private String authCode;
    private String idempotencyKey;
    private String errorMessage;
    private String traceId;
    private LocalDateTime createTime;
}
