package com.pos.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pos.checkout.domain.InventoryReservation;
import com.pos.checkout.domain.ReservationStatus;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Mapper
public interface InventoryReservationMapper extends BaseMapper<InventoryReservation> {

    /**
     * Quantity held by ACTIVE reservations, including ones past expiresAt that the sweep has not reached.
     */
    @Select("""
            SELECT COALESCE(SUM(quantity), 0) FROM inventory_reservation
            WHERE inventory_id = #{inventoryId}
              AND status = 'ACTIVE'
            """)
    BigDecimal sumActiveQuantity(@Param("inventoryId") Long inventoryId);

    /**
     * Moves one ACTIVE reservation to a terminal status. Returns 0 when it was not ACTIVE any more.
     */
    @Update("""
            UPDATE inventory_reservation
            SET status = #{status},
                released_at = #{now},
                release_reason = #{reason},
                update_time = #{now}
            WHERE id = #{id}
              AND status = 'ACTIVE'
            """)
    int closeIfActive(@Param("id") Long id,
                      @Param("status") ReservationStatus status,
                      @Param("reason") String reason,
                      @Param("now") LocalDateTime now);

    /**
     * Converts an ACTIVE or EXPIRED reservation into a sale. Returns 0 when it was released or already finalized.
     */
    @Update("""
            UPDATE inventory_reservation
            SET status = 'FINALIZED',
                released_at = #{now},
                release_reason = #{reason},
                update_time = #{now}
            WHERE id = #{id}
              AND status IN ('ACTIVE', 'EXPIRED')
            """)
    int finalizeIfOpen(@Param("id") Long id,
                       @Param("reason") String reason,
                       @Param("now") LocalDateTime now);

    /**
     * Expires overdue ACTIVE reservations. Reservations of a paid order, or of one waiting for an
     * INVENTORY_FINALIZE/ORDER_FINALIZE repair, stay ACTIVE: that stock is already sold.
     */
    @Update("""
            UPDATE inventory_reservation
            SET status = 'EXPIRED',
                released_at = #{now},
                release_reason = 'expired',
                update_time = #{now}
            WHERE status = 'ACTIVE'
              AND expires_at < #{now}
              AND NOT EXISTS (
                  SELECT 1 FROM orders o
                  WHERE o.id = inventory_reservation.order_id
                    AND (o.status = 'COMPLETED' OR o.payment_status = 'PAID'))
              AND NOT EXISTS (
                  SELECT 1 FROM reconciliation_queue_item q
                  WHERE q.order_id = inventory_reservation.order_id
                    AND q.resolved = FALSE
                    AND q.kind IN ('INVENTORY_FINALIZE', 'ORDER_FINALIZE'))
            """)
    int expireOverdue(@Param("now") LocalDateTime now);
}
