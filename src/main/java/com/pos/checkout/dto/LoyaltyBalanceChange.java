package com.pos.checkout.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LoyaltyBalanceChange {
    private int balanceBefore;
    private int balanceAfter;
}
