package com.pos.checkout.gateway;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChargeResult {
    private ChargeOutcome outcome;
    private String referenceId;
    private String authCode;
    private BigDecimal amount;
    private String reason;

    public boolean isApproved() {
        return outcome == ChargeOutcome.APPROVED;
    }

    /**
     * Approved or declined. An error or an unknown outcome may still turn into a capture.
     */
    public boolean isSettled() {
        return outcome == ChargeOutcome.APPROVED || outcome == ChargeOutcome.DECLINED;
    }

    public static ChargeResult approved(String referenceId, String authCode, BigDecimal amount) {
        return ChargeResult.builder()
                .outcome(ChargeOutcome.APPROVED)
                .referenceId(referenceId)
                .authCode(authCode)
                .amount(amount)
                .build();
    }

    public static ChargeResult declined(String reason) {
        return ChargeResult.builder().outcome(ChargeOutcome.DECLINED).reason(reason).build();
    }

    public static ChargeResult error(String reason) {
        return ChargeResult.builder().outcome(ChargeOutcome.ERROR).reason(reason).build();
    }

    public static ChargeResult unknown(String reason) {
        return ChargeResult.builder().outcome(ChargeOutcome.UNKNOWN).reason(reason).build();
    }
}
