package com.pos.checkout.task;

import com.pos.checkout.business.CheckoutOrchestrator;
import com.pos.checkout.config.CheckoutProperties;
import com.pos.checkout.domain.Order;
import com.pos.checkout.service.IInventoryReservationService;
import com.pos.checkout.service.ILoyaltyLedgerService;
import com.pos.checkout.service.IOrderLedgerService;
import com.pos.checkout.util.TraceIdUtil;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 回收崩溃的结账遗留的数据：过期的库存预留、过期的积分冻结，
 * 以及超过预留有效期的 PENDING 草稿订单。
 */
@Slf4j
@Component
@EnableScheduling
public class ReservationSweepTask {

    private final IInventoryReservationService inventoryReservationService;
    private final ILoyaltyLedgerService loyaltyLedgerService;
    private final IOrderLedgerService orderLedgerService;
    private final CheckoutOrchestrator checkoutOrchestrator;
    private final CheckoutProperties checkoutProperties;
    private final boolean enabled;

    public ReservationSweepTask(IInventoryReservationService inventoryReservationService,
                                ILoyaltyLedgerService loyaltyLedgerService,
                                IOrderLedgerService orderLedgerService,
                                CheckoutOrchestrator checkoutOrchestrator,
                                CheckoutProperties checkoutProperties,
                                @Value("${checkout.sweep.enabled:true}") boolean enabled) {
        this.inventoryReservationService = inventoryReservationService;
        this.loyaltyLedgerService = loyaltyLedgerService;
        this.orderLedgerService = orderLedgerService;
        this.checkoutOrchestrator = checkoutOrchestrator;
        this.checkoutProperties = checkoutProperties;
        this.enabled = enabled;
    }

    @Scheduled(cron = "${checkout.sweep.cron:0 */1 * * * *}")
    public void sweep() {
        if (!enabled) {
            return;
        }
        TraceIdUtil.setTraceId(TraceIdUtil.generateTraceId());
        try {
            sweepOnce();
        } catch (Exception e) {
            log.error("[清理失败] errorMsg={}", e.getMessage(), e);
        } finally {
            TraceIdUtil.clearTraceId();
        }
    }

    public SweepResult sweepOnce() {
        // ==================== 1. Stale drafts ====================
        LocalDateTime cutoff = LocalDateTime.now().minus(checkoutProperties.getReservationTtl());
        List<Order> stale = orderLedgerService.listStalePending(cutoff);
        int abandoned = 0;
        for (Order order : stale) {
            try {
                if (checkoutOrchestrator.abandonStaleDraft(order)) {
                    abandoned++;
                }
            } catch (Exception e) {
                log.error("[过期草稿订单清理失败] orderId={}, errorMsg={}", order.getId(), e.getMessage(), e);
            }
        }

        // ==================== 2. Expired holds ====================
        int reservations = inventoryReservationService.sweepExpired();
        int holds = loyaltyLedgerService.expireHolds();

        if (abandoned + reservations + holds > 0) {
            log.info("[清理完成] staleOrders={}, expiredReservations={}, expiredLoyaltyHolds={}",
                    abandoned, reservations, holds);
        }
        return new SweepResult(abandoned, reservations, holds);
    }

    @Getter
    @AllArgsConstructor
    public static class SweepResult {
        private final int abandonedOrders;
        private final int expiredReservations;
        private final int expiredHolds;
    }
}
