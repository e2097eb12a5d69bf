package com.pos.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pos.checkout.domain.LoyaltyTransaction;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;

@Mapper
public interface LoyaltyTransactionMapper extends BaseMapper<LoyaltyTransaction> {

    @Select("""
            SELECT COALESCE(SUM(points), 0) FROM loyalty_transaction
            WHERE customer_id = #{customerId}
            """)
    int sumPoints(@Param("customerId") String customerId);
}
