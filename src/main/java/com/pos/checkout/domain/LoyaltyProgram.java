package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("loyalty_program")
public class LoyaltyProgram {
    private Long id;
    private String vendorId;
    private BigDecimal pointsPerDollar;
    private Boolean active;
    private LocalDateTime createTime;
    private LocalDateTime updateTime;
}
