package com.pos.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CheckoutItem {
    private String productId;
    private String productName;
    /**
     * Cart quantity; prices and receipts use this
     */
    private Integer quantity;
    /**
     * Pricing tier label, e.g. "28g (Ounce)". Absent for plain unit sales.
     */
    private String tierName;
    /**
     * Stock taken from inventory for the whole line (tier quantity x cart quantity), in grams or units.
     * Required: a tiered line must never fall back to the cart quantity.
     */
    private BigDecimal quantityToDeduct;
    private BigDecimal unitPrice;
}
