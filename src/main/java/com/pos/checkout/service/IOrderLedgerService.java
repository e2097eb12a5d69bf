package com.pos.checkout.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.pos.checkout.domain.Order;
import com.pos.checkout.domain.OrderLine;
import com.pos.checkout.domain.PaymentTransaction;
import com.pos.checkout.dto.CheckoutItem;
import com.pos.checkout.dto.CheckoutResult;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 订单账本
 *
 * 负责订单行从草稿到完结的全过程。已完结的订单不再改写，
 * 下面每个状态流转都以订单仍为 PENDING 为前提。
 */
public interface IOrderLedgerService extends IService<Order> {

    /**
     * 在同一事务中写入 PENDING 草稿（占用幂等键）并预留所有明细。
     *
     * @throws org.springframework.dao.DuplicateKeyException 幂等键已被其他请求占用时
     * @throws com.pos.checkout.exception.InsufficientStockException 任一明细无法预留时
     */
    void createDraftWithReservations(Order draft, List<CheckoutItem> items);

    List<OrderLine> insertLines(String orderId, List<CheckoutItem> items);

    /**
     * 释放草稿的预留并删除草稿，释放幂等键。
     */
    void discardDraft(String orderId, String reason);

    /**
     * 置为 CANCELLED/FAILED 并保存结果；释放库存预留和积分冻结。
     *
     * @return 订单已不是 PENDING 时返回 false
     */
    boolean cancel(String orderId, String reason, CheckoutResult result, List<PaymentTransaction> attempts);

    /**
     * 在同一事务中置为 COMPLETED/PAID、写入支付记录并扣减库存。
     *
     * @throws IllegalStateException 订单已不是 PENDING 时
     */
    void complete(String orderId, CheckoutResult result, List<PaymentTransaction> payments);

    /**
     * 只置为 COMPLETED/PAID 并写入支付记录；库存交由对账处理。
     *
     * @return 订单已完结时返回 false
     */
    boolean completeWithoutInventory(String orderId, CheckoutResult result, List<PaymentTransaction> payments);

    /**
     * 迟到的扣款撤销后，将 CANCELLED/FAILED 改为 CANCELLED/REFUNDED。
     *
     * @return 订单不是支付失败的取消订单时返回 false
     */
    boolean markRefunded(String orderId, String referenceId);

    Order findByIdempotencyKey(String idempotencyKey);

    List<Order> listStalePending(LocalDateTime createdBefore);

    List<OrderLine> listLines(String orderId);

    List<PaymentTransaction> listPayments(String orderId);
}
