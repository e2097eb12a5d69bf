package com.pos.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pos.checkout.domain.LoyaltyHold;
import com.pos.checkout.domain.LoyaltyHoldStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.LocalDateTime;

@Mapper
public interface LoyaltyHoldMapper extends BaseMapper<LoyaltyHold> {

    @Select("""
            SELECT COALESCE(SUM(points), 0) FROM loyalty_hold
            WHERE customer_id = #{customerId}
              AND status = 'ACTIVE'
            """)
    int sumActivePoints(@Param("customerId") String customerId);

    @Update("""
            UPDATE loyalty_hold
            SET status = #{status},
                released_at = #{now},
                update_time = #{now}
            WHERE order_id = #{orderId}
              AND status = 'ACTIVE'
            """)
    int closeActiveForOrder(@Param("orderId") String orderId,
                            @Param("status") LoyaltyHoldStatus status,
                            @Param("now") LocalDateTime now);

    @Update("""
            UPDATE loyalty_hold
            SET status = 'EXPIRED',
                released_at = #{now},
                update_time = #{now}
            WHERE status = 'ACTIVE'
              AND expires_at < #{now}
            """)
    int expireOverdue(@Param("now") LocalDateTime now);
}
