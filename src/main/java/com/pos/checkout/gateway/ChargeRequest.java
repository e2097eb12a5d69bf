package com.pos.checkout.gateway;

import com.pos.checkout.domain.PaymentMethod;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChargeRequest {
    private BigDecimal amount;
    private PaymentMethod method;
    /**
     * Same key as the checkout; the gateway must not capture twice for it
     */
    private String idempotencyKey;
    private Map<String, String> metadata;
}
