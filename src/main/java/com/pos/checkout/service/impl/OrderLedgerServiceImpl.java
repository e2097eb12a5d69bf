package com.pos.checkout.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pos.checkout.domain.Order;
import com.pos.checkout.domain.OrderLine;
import com.pos.checkout.domain.OrderStatus;
import com.pos.checkout.domain.PaymentStatus;
import com.pos.checkout.domain.PaymentTransaction;
import com.pos.checkout.dto.CheckoutItem;
import com.pos.checkout.dto.CheckoutResult;
import com.pos.checkout.mapper.OrderLineMapper;
import com.pos.checkout.mapper.OrderMapper;
import com.pos.checkout.mapper.PaymentTransactionMapper;
import com.pos.checkout.service.IInventoryReservationService;
import com.pos.checkout.service.ILoyaltyLedgerService;
import com.pos.checkout.service.IOrderLedgerService;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Service
public class OrderLedgerServiceImpl extends ServiceImpl<OrderMapper, Order> implements IOrderLedgerService {

    private final OrderLineMapper orderLineMapper;
    private final PaymentTransactionMapper paymentTransactionMapper;
    private final IInventoryReservationService inventoryReservationService;
    private final ILoyaltyLedgerService loyaltyLedgerService;
    private final ObjectMapper objectMapper;

    public OrderLedgerServiceImpl(OrderLineMapper orderLineMapper,
                                  PaymentTransactionMapper paymentTransactionMapper,
                                  IInventoryReservationService inventoryReservationService,
                                  ILoyaltyLedgerService loyaltyLedgerService,
                                  ObjectMapper objectMapper) {
        this.orderLineMapper = orderLineMapper;
        this.paymentTransactionMapper = paymentTransactionMapper;
        this.inventoryReservationService = inventoryReservationService;
        this.loyaltyLedgerService = loyaltyLedgerService;
        this.objectMapper = objectMapper;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void createDraftWithReservations(Order draft, List<CheckoutItem> items) {
        // ==================== 1. Claim the idempotency key ====================
        save(draft);

        // ==================== 2. Reserve stock ====================
        inventoryReservationService.reserveAll(draft.getId(), draft.getLocationId(), items);

        log.info("[草稿订单已创建] orderId={}, orderNumber={}, lines={}, traceId={}",
                draft.getId(), draft.getOrderNumber(), items.size(), draft.getTraceId());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public List<OrderLine> insertLines(String orderId, List<CheckoutItem> items) {
        LocalDateTime now = LocalDateTime.now();
        List<OrderLine> lines = new ArrayList<>(items.size());
        for (CheckoutItem item : items) {
            OrderLine line = OrderLine.builder()
                    .orderId(orderId)
                    .productId(item.getProductId())
                    .productName(item.getProductName())
                    .quantity(item.getQuantity())
                    .tierName(item.getTierName())
                    .quantityToDeduct(item.getQuantityToDeduct())
                    .unitPrice(item.getUnitPrice())
                    .lineTotal(item.getUnitPrice().multiply(BigDecimal.valueOf(item.getQuantity())))
                    .createTime(now)
                    .build();
            orderLineMapper.insert(line);
            lines.add(line);
        }
        return lines;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void discardDraft(String orderId, String reason) {
        int released = inventoryReservationService.releaseForOrder(orderId, reason);
        loyaltyLedgerService.releaseHold(orderId);
        orderLineMapper.delete(new LambdaQueryWrapper<OrderLine>().eq(OrderLine::getOrderId, orderId));
        removeById(orderId);
        log.warn("[草稿订单已丢弃] orderId={}, reason={}, releasedReservations={}, traceId={}",
                orderId, reason, released, TraceIdUtil.getTraceId());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean cancel(String orderId, String reason, CheckoutResult result, List<PaymentTransaction> attempts) {
        // ==================== 1. Resolve the draft ====================
        int updated = baseMapper.resolvePending(orderId, OrderStatus.CANCELLED, PaymentStatus.FAILED,
                writeResult(result));
        if (updated == 0) {
            log.warn("[跳过取消] order already resolved, orderId={}, reason={}", orderId, reason);
            return false;
        }

        // ==================== 2. Release holds ====================
        int released = inventoryReservationService.releaseForOrder(orderId, reason);
        loyaltyLedgerService.releaseHold(orderId);

        // ==================== 3. Record attempts ====================
        insertPayments(attempts);

        log.info("[订单已取消] orderId={}, reason={}, releasedReservations={}, traceId={}",
                orderId, reason, released, TraceIdUtil.getTraceId());
        return true;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void complete(String orderId, CheckoutResult result, List<PaymentTransaction> payments) {
        // ==================== 1. Resolve the draft ====================
        if (baseMapper.resolvePending(orderId, OrderStatus.COMPLETED, PaymentStatus.PAID, writeResult(result)) == 0) {
            throw new IllegalStateException("Order " + orderId + " is no longer pending");
        }

        // ==================== 2. Payment rows ====================
        insertPayments(payments);

        // ==================== 3. Inventory deduction ====================
        int finalized = inventoryReservationService.finalizeForOrder(orderId);

        log.info("[订单已完成] orderId={}, payments={}, finalizedReservations={}, traceId={}",
                orderId, payments.size(), finalized, TraceIdUtil.getTraceId());
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean completeWithoutInventory(String orderId, CheckoutResult result, List<PaymentTransaction> payments) {
        if (baseMapper.resolvePending(orderId, OrderStatus.COMPLETED, PaymentStatus.PAID, writeResult(result)) == 0) {
            return false;
        }
        insertPayments(payments);
        log.warn("[订单已完成（库存待确认）] orderId={}, traceId={}", orderId, TraceIdUtil.getTraceId());
        return true;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean markRefunded(String orderId, String referenceId) {
        boolean refunded = baseMapper.markRefunded(orderId) > 0;
        if (refunded) {
            log.info("[订单已退款] orderId={}, referenceId={}, traceId={}",
                    orderId, referenceId, TraceIdUtil.getTraceId());
        } else {
            log.warn("[跳过退款标记] order not a failed cancellation, orderId={}, referenceId={}",
                    orderId, referenceId);
        }
        return refunded;
    }

    @Override
    public Order findByIdempotencyKey(String idempotencyKey) {
        return baseMapper.selectByIdempotencyKey(idempotencyKey);
    }

    @Override
    public List<Order> listStalePending(LocalDateTime createdBefore) {
        return lambdaQuery()
                .eq(Order::getStatus, OrderStatus.PENDING)
                .lt(Order::getCreateTime, createdBefore)
                .orderByAsc(Order::getCreateTime)
                .list();
    }

    @Override
    public List<OrderLine> listLines(String orderId) {
        return orderLineMapper.selectList(new LambdaQueryWrapper<OrderLine>()
                .eq(OrderLine::getOrderId, orderId)
                .orderByAsc(OrderLine::getId));
    }

    @Override
    public List<PaymentTransaction> listPayments(String orderId) {
        return paymentTransactionMapper.selectList(new LambdaQueryWrapper<PaymentTransaction>()
                .eq(PaymentTransaction::getOrderId, orderId)
                .orderByAsc(PaymentTransaction::getId));
    }

    private void insertPayments(List<PaymentTransaction> payments) {
        if (payments == null) {
            return;
        }
        for (PaymentTransaction payment : payments) {
            // rows replayed from a reconciliation payload already carry an id
            payment.setId(null);
            paymentTransactionMapper.insert(payment);
        }
    }

    private String writeResult(CheckoutResult result) {
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize checkout result", e);
        }
    }
}
