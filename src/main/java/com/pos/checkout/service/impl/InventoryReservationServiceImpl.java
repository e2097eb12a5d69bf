package com.pos.checkout.service.impl;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.pos.checkout.config.CheckoutProperties;
import com.pos.checkout.domain.Inventory;
import com.pos.checkout.domain.InventoryReservation;
import com.pos.checkout.domain.ReservationStatus;
import com.pos.checkout.domain.StockMovement;
import com.pos.checkout.dto.CheckoutItem;
import com.pos.checkout.exception.InsufficientStockException;
import com.pos.checkout.exception.ReservationStateException;
import com.pos.checkout.mapper.InventoryMapper;
import com.pos.checkout.mapper.InventoryReservationMapper;
import com.pos.checkout.mapper.StockMovementMapper;
import com.pos.checkout.service.IInventoryReservationService;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 基于库存表行锁的预留管理
 *
 * 加锁规则：
 * 1. 所有会导致写入的计数读取都通过 SELECT ... FOR UPDATE
 * 2. 购物车按 productId 升序锁定商品，两个购物车不会死锁
 * 3. 锁只存在于获取它的短事务期间
 */
@Slf4j
@Service
public class InventoryReservationServiceImpl extends ServiceImpl<InventoryReservationMapper, InventoryReservation>
        implements IInventoryReservationService {

    public static final String MOVEMENT_SALE = "sale";
    public static final String REASON_FINALIZED = "finalized";

    private final InventoryMapper inventoryMapper;
    private final StockMovementMapper stockMovementMapper;
    private final CheckoutProperties checkoutProperties;

    public InventoryReservationServiceImpl(InventoryMapper inventoryMapper,
                                           StockMovementMapper stockMovementMapper,
                                           CheckoutProperties checkoutProperties) {
        this.inventoryMapper = inventoryMapper;
        this.stockMovementMapper = stockMovementMapper;
        this.checkoutProperties = checkoutProperties;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public InventoryReservation reserve(String productId, String locationId, BigDecimal quantity, String orderId) {
        String traceId = TraceIdUtil.getTraceId();

        // ==================== 1. Lock the counter row ====================
        Inventory inventory = inventoryMapper.selectForUpdate(productId, locationId);
        if (inventory == null) {
            log.warn("[预留被拒绝] unknown product, productId={}, locationId={}, orderId={}, traceId={}",
                    productId, locationId, orderId, traceId);
            throw new InsufficientStockException(productId, quantity, BigDecimal.ZERO);
        }

        // ==================== 2. Check availability under the lock ====================
        BigDecimal held = baseMapper.sumActiveQuantity(inventory.getId());
        BigDecimal available = inventory.getQuantityOnHand().subtract(held);
        if (available.compareTo(quantity) < 0) {
            log.warn("[预留被拒绝] productId={}, onHand={}, held={}, requested={}, orderId={}, traceId={}",
                    productId, inventory.getQuantityOnHand(), held, quantity, orderId, traceId);
            throw new InsufficientStockException(productId, quantity, available.max(BigDecimal.ZERO));
        }

        // ==================== 3. Insert the hold in the same transaction ====================
        LocalDateTime now = LocalDateTime.now();
        InventoryReservation reservation = InventoryReservation.builder()
                .inventoryId(inventory.getId())
                .productId(productId)
                .locationId(locationId)
                .orderId(orderId)
                .quantity(quantity)
                .status(ReservationStatus.ACTIVE)
                .expiresAt(now.plus(checkoutProperties.getReservationTtl()))
                .createTime(now)
                .updateTime(now)
                .build();
        save(reservation);

        log.info("[库存已预留] reservationId={}, productId={}, quantity={}, availableAfter={}, orderId={}, traceId={}",
                reservation.getId(), productId, quantity, available.subtract(quantity), orderId, traceId);
        return reservation;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public List<InventoryReservation> reserveAll(String orderId, String locationId, List<CheckoutItem> items) {
        Map<String, BigDecimal> quantityByProduct = new TreeMap<>();
        for (CheckoutItem item : items) {
            quantityByProduct.merge(item.getProductId(), item.getQuantityToDeduct(), BigDecimal::add);
        }

        List<InventoryReservation> reservations = new ArrayList<>(quantityByProduct.size());
        for (Map.Entry<String, BigDecimal> entry : quantityByProduct.entrySet()) {
            reservations.add(reserve(entry.getKey(), locationId, entry.getValue(), orderId));
        }
        return reservations;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void finalizeReservation(Long reservationId) {
        String traceId = TraceIdUtil.getTraceId();

        InventoryReservation reservation = getById(reservationId);
        if (reservation == null) {
            throw new ReservationStateException("Reservation not found: " + reservationId);
        }
        if (reservation.getStatus() == ReservationStatus.FINALIZED) {
            log.info("[跳过预留确认] already finalized, reservationId={}, traceId={}", reservationId, traceId);
            return;
        }
        if (reservation.getStatus() == ReservationStatus.RELEASED) {
            throw new ReservationStateException("Reservation " + reservationId + " is " + reservation.getStatus());
        }

        // ==================== 1. Lock the counter and deduct ====================
        Inventory inventory = inventoryMapper.selectByIdForUpdate(reservation.getInventoryId());
        BigDecimal quantityBefore = inventory.getQuantityOnHand();
        if (reservation.getStatus() == ReservationStatus.EXPIRED) {
            // the hold lapsed before a paid order was finalized; its units may already be promised again
            BigDecimal held = baseMapper.sumActiveQuantity(inventory.getId());
            BigDecimal free = quantityBefore.subtract(held);
            log.warn("[确认已过期预留] reservationId={}, productId={}, quantity={}, onHand={}, held={}, orderId={}, traceId={}",
                    reservationId, reservation.getProductId(), reservation.getQuantity(), quantityBefore, held,
                    reservation.getOrderId(), traceId);
            if (free.compareTo(reservation.getQuantity()) < 0) {
                log.error("[已过期预留确认超卖] reservationId={}, productId={}, shortBy={}, traceId={}",
                        reservationId, reservation.getProductId(),
                        reservation.getQuantity().subtract(free.max(BigDecimal.ZERO)), traceId);
            }
        }
        if (inventoryMapper.deductOnHand(inventory.getId(), reservation.getQuantity()) == 0) {
            throw new ReservationStateException("On-hand " + quantityBefore.toPlainString() + " below reserved quantity "
                    + reservation.getQuantity().toPlainString() + " for product " + reservation.getProductId());
        }

        // ==================== 2. Close the hold ====================
        LocalDateTime now = LocalDateTime.now();
        if (baseMapper.finalizeIfOpen(reservationId, REASON_FINALIZED, now) == 0) {
            // released or finalized between the read and the lock; roll the deduction back
            throw new ReservationStateException("Reservation " + reservationId + " closed concurrently");
        }

        // ==================== 3. Stock movement ====================
        BigDecimal quantityAfter = quantityBefore.subtract(reservation.getQuantity());
        stockMovementMapper.insert(StockMovement.builder()
                .inventoryId(inventory.getId())
                .productId(reservation.getProductId())
                .locationId(reservation.getLocationId())
                .orderId(reservation.getOrderId())
                .movementType(MOVEMENT_SALE)
                .quantity(reservation.getQuantity().negate())
                .quantityBefore(quantityBefore)
                .quantityAfter(quantityAfter)
                .traceId(traceId)
                .createTime(now)
                .build());

        log.info("[预留已确认] reservationId={}, productId={}, quantityBefore={}, quantityAfter={}, orderId={}, traceId={}",
                reservationId, reservation.getProductId(), quantityBefore, quantityAfter,
                reservation.getOrderId(), traceId);
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int finalizeForOrder(String orderId) {
        List<InventoryReservation> reservations = lambdaQuery()
                .eq(InventoryReservation::getOrderId, orderId)
                .ne(InventoryReservation::getStatus, ReservationStatus.FINALIZED)
                .orderByAsc(InventoryReservation::getProductId)
                .list();
        for (InventoryReservation reservation : reservations) {
            finalizeReservation(reservation.getId());
        }
        return reservations.size();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean release(Long reservationId, String reason) {
        boolean released = baseMapper.closeIfActive(reservationId, ReservationStatus.RELEASED, reason,
                LocalDateTime.now()) > 0;
        if (released) {
            log.info("[预留已释放] reservationId={}, reason={}, traceId={}",
                    reservationId, reason, TraceIdUtil.getTraceId());
        } else {
            log.debug("[跳过预留释放] reservation not active, reservationId={}", reservationId);
        }
        return released;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int releaseForOrder(String orderId, String reason) {
        List<InventoryReservation> active = lambdaQuery()
                .eq(InventoryReservation::getOrderId, orderId)
                .eq(InventoryReservation::getStatus, ReservationStatus.ACTIVE)
                .list();
        int released = 0;
        for (InventoryReservation reservation : active) {
            if (release(reservation.getId(), reason)) {
                released++;
            }
        }
        return released;
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public int sweepExpired() {
        int expired = baseMapper.expireOverdue(LocalDateTime.now());
        if (expired > 0) {
            log.info("[预留清理] expired={}", expired);
        }
        return expired;
    }

    @Override
    public BigDecimal availableQuantity(String productId, String locationId) {
        Inventory inventory = inventoryMapper.selectOne(
                new LambdaQueryWrapper<Inventory>()
                        .eq(Inventory::getProductId, productId)
                        .eq(Inventory::getLocationId, locationId));
        if (inventory == null) {
            return BigDecimal.ZERO;
        }
        return inventory.getQuantityOnHand()
                .subtract(baseMapper.sumActiveQuantity(inventory.getId()))
                .max(BigDecimal.ZERO);
    }
}
