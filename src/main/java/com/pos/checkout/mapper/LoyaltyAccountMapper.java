package com.pos.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pos.checkout.domain.LoyaltyAccount;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface LoyaltyAccountMapper extends BaseMapper<LoyaltyAccount> {

    /**
     * Exclusive lock on the customer's balance row for the rest of the transaction.
     */
    @Select("""
            SELECT * FROM loyalty_account
            WHERE customer_id = #{customerId}
            FOR UPDATE
            """)
    LoyaltyAccount selectForUpdate(@Param("customerId") String customerId);

    @Update("""
            UPDATE loyalty_account
            SET points_balance = #{balance},
                version = version + 1,
                update_time = CURRENT_TIMESTAMP
            WHERE id = #{id}
            """)
    int updateBalance(@Param("id") Long id, @Param("balance") Integer balance);
}
