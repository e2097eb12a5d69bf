package com.pos.checkout.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.pos.checkout.domain.PaymentTransaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 修复所需的数据，序列化到 ReconciliationQueueItem.payload 中。字段随类型不同而不同。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReconciliationPayload {
    // LOYALTY_UPDATE
    private String customerId;
    private Integer pointsEarned;
    private Integer pointsRedeemed;
    private BigDecimal orderTotal;

    // SESSION_TOTALS
    private String sessionId;
    private BigDecimal cashAmount;
    private BigDecimal cardAmount;

    // PAYMENT_OUTCOME_UNKNOWN
    private String idempotencyKey;
    private BigDecimal amount;
    private String referenceId;

    // ORDER_FINALIZE
    private List<PaymentTransaction> payments;

    private String errorMessage;
}
