package com.pos.checkout.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.pos.checkout.domain.Inventory;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.math.BigDecimal;

@Mapper
public interface InventoryMapper extends BaseMapper<Inventory> {

    /**
     * Locks the counter row until the surrounding transaction ends.
     */
    @Select("""
            SELECT * FROM inventory
            WHERE product_id = #{productId}
              AND location_id = #{locationId}
            FOR UPDATE
            """)
    Inventory selectForUpdate(@Param("productId") String productId,
                              @Param("locationId") String locationId);

    @Select("""
            SELECT * FROM inventory
            WHERE id = #{id}
            FOR UPDATE
            """)
    Inventory selectByIdForUpdate(@Param("id") Long id);

    /**
     * Permanent deduction. The on-hand guard keeps the counter non-negative even if a caller skipped the lock.
     *
     * @return updated rows (0 when stock would go negative)
     */
    @Update("""
            UPDATE inventory
            SET quantity_on_hand = quantity_on_hand - #{quantity},
                version = version + 1,
                update_time = CURRENT_TIMESTAMP
            WHERE id = #{id}
              AND quantity_on_hand >= #{quantity}
            """)
    int deductOnHand(@Param("id") Long id, @Param("quantity") BigDecimal quantity);
}
