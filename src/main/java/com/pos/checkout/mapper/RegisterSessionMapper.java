package com.pos.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pos.checkout.domain.RegisterSession;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.math.BigDecimal;

@Mapper
public interface RegisterSessionMapper extends BaseMapper<RegisterSession> {

    @Select("""
            SELECT * FROM register_session
            WHERE session_id = #{sessionId}
            FOR UPDATE
            """)
    RegisterSession selectForUpdate(@Param("sessionId") String sessionId);

    @Update("""
            UPDATE register_session
            SET total_sales = total_sales + #{total},
                cash_sales = cash_sales + #{cash},
                card_sales = card_sales + #{card},
                transaction_count = transaction_count + 1,
                update_time = CURRENT_TIMESTAMP
            WHERE session_id = #{sessionId}
            """)
    int addPayment(@Param("sessionId") String sessionId,
                   @Param("total") BigDecimal total,
                   @Param("cash") BigDecimal cash,
                   @Param("card") BigDecimal card);
}
