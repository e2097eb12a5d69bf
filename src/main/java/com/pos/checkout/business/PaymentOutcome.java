package com.pos.checkout.business;

import com.pos.checkout.domain.PaymentTransaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 支付步骤的决定，以及需要随订单一起写入的 PaymentTransaction 记录。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PaymentOutcome {

    public enum Status {
        APPROVED,
        /** Explicit decline or processor error: nothing captured. */
        DECLINED,
        /** No answer within the timeout and none after polling. */
        UNKNOWN
    }

    private Status status;
    private List<PaymentTransaction> transactions;
    private String reason;
    private BigDecimal cashAmount;
    private BigDecimal cardAmount;
    private String cardReferenceId;

    public boolean isApproved() {
        return status == Status.APPROVED;
    }
}
