package com.pos.checkout.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.pos.checkout.domain.InventoryReservation;
import com.pos.checkout.dto.CheckoutItem;

import java.math.BigDecimal;
import java.util.List;

/**
 * 库存预留管理
 *
 * 预留为处理中的订单占用库存，防止并发结账超卖：
 * - reserve：加行锁读取计数，与 ACTIVE 预留比较后插入预留
 * - finalize：将预留转为永久扣减并写入库存流水
 * - release：将预留释放回库存，重复释放无副作用
 * - sweep：将编排器从未确认或释放的预留标记为过期
 */
public interface IInventoryReservationService extends IService<InventoryReservation> {

    /**
     * 预留单个商品。存在调用方事务时加入该事务。
     *
     * @throws com.pos.checkout.exception.InsufficientStockException 现有库存减去 ACTIVE 预留后不足时
     */
    InventoryReservation reserve(String productId, String locationId, BigDecimal quantity, String orderId);

    /**
     * 按 quantityToDeduct 预留购物车所有明细，按商品汇总并按商品顺序加锁。
     * 在外层事务中全部成功或全部失败。
     */
    List<InventoryReservation> reserveAll(String orderId, String locationId, List<CheckoutItem> items);

    /**
     * 将 ACTIVE 预留转为扣减，重复确认无副作用。
     * EXPIRED 预留只会为已支付订单确认，仍在计数行锁下扣减。
     *
     * @throws com.pos.checkout.exception.ReservationStateException 预留已被释放，
     *                                                              或现有库存不足以扣减时
     */
    void finalizeReservation(Long reservationId);

    /**
     * 确认订单所有尚未确认的预留。
     *
     * @return 本次确认的预留数
     */
    int finalizeForOrder(String orderId);

    /**
     * @return 本次释放返回 true，已不是 ACTIVE 时返回 false
     */
    boolean release(Long reservationId, String reason);

    int releaseForOrder(String orderId, String reason);

    /**
     * 将超过有效期的 ACTIVE 预留标记为 EXPIRED，
     * 已支付订单和等待 INVENTORY_FINALIZE/ORDER_FINALIZE 修复的订单除外。
     *
     * @return 回收的预留数
     */
    int sweepExpired();

    /**
     * 现有库存减去 ACTIVE 预留；未知商品返回 0。
     */
    BigDecimal availableQuantity(String productId, String locationId);
}
