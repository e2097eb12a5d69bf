package com.pos.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pos.checkout.domain.Order;
import com.pos.checkout.domain.OrderStatus;
import com.pos.checkout.domain.PaymentStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

@Mapper
public interface OrderMapper extends BaseMapper<Order> {

    @Select("""
            SELECT * FROM orders
            WHERE idempotency_key = #{idempotencyKey}
            """)
    Order selectByIdempotencyKey(@Param("idempotencyKey") String idempotencyKey);

    /**
     * Resolves a draft. Only a PENDING order can move, so a resolved order is never rewritten.
     *
     * @return updated rows (0 when the order was already resolved)
     */
    @Update("""
            UPDATE orders
            SET status = #{status},
                payment_status = #{paymentStatus},
                result_payload = #{resultPayload},
                update_time = CURRENT_TIMESTAMP
            WHERE id = #{id}
              AND status = 'PENDING'
            """)
    int resolvePending(@Param("id") String id,
                       @Param("status") OrderStatus status,
                       @Param("paymentStatus") PaymentStatus paymentStatus,
                       @Param("resultPayload") String resultPayload);

    /**
     * A cancelled order whose card was captured late and then voided.
     *
     * @return updated rows (0 when the order is not CANCELLED/FAILED)
     */
    @Update("""
            UPDATE orders
            SET payment_status = 'REFUNDED',
                update_time = CURRENT_TIMESTAMP
            WHERE id = #{id}
              AND status = 'CANCELLED'
              AND payment_status = 'FAILED'
            """)
    int markRefunded(@Param("id") String id);
}
