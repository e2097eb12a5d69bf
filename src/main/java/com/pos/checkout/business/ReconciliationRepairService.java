package com.pos.checkout.business;

import com.pos.checkout.domain.Order;
import com.pos.checkout.domain.OrderStatus;
import com.pos.checkout.domain.PaymentStatus;
import com.pos.checkout.domain.ReconciliationQueueItem;
import com.pos.checkout.dto.CheckoutResult;
import com.pos.checkout.dto.ReconciliationPayload;
import com.pos.checkout.gateway.ChargeOutcome;
import com.pos.checkout.gateway.ChargeResult;
import com.pos.checkout.gateway.PaymentGateway;
import com.pos.checkout.service.IInventoryReservationService;
import com.pos.checkout.service.ILoyaltyLedgerService;
import com.pos.checkout.service.IOrderLedgerService;
import com.pos.checkout.service.IReconciliationQueueService;
import com.pos.checkout.service.ISessionTotalsService;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * 对账修复
 * - 按订单当前状态重新执行队列项对应的失败步骤
 * - 每种修复都是幂等的，同一失败重复入队也无害
 * - 由重试任务、MQ 消费者和运维接口调用
 */
@Slf4j
@Service
public class ReconciliationRepairService {

    private final IReconciliationQueueService reconciliationQueueService;
    private final IOrderLedgerService orderLedgerService;
    private final IInventoryReservationService inventoryReservationService;
    private final ILoyaltyLedgerService loyaltyLedgerService;
    private final ISessionTotalsService sessionTotalsService;
    private final PaymentGateway paymentGateway;

    public ReconciliationRepairService(IReconciliationQueueService reconciliationQueueService,
                                       IOrderLedgerService orderLedgerService,
                                       IInventoryReservationService inventoryReservationService,
                                       ILoyaltyLedgerService loyaltyLedgerService,
                                       ISessionTotalsService sessionTotalsService,
                                       PaymentGateway paymentGateway) {
        this.reconciliationQueueService = reconciliationQueueService;
        this.orderLedgerService = orderLedgerService;
        this.inventoryReservationService = inventoryReservationService;
        this.loyaltyLedgerService = loyaltyLedgerService;
        this.sessionTotalsService = sessionTotalsService;
        this.paymentGateway = paymentGateway;
    }

    /**
     * Repairs and resolves one item. A failed repair is recorded on the item and rethrown.
     *
     * @return resolution notes
     * @throws IllegalArgumentException when the item does not exist
     */
    public String repairById(Long itemId) {
        ReconciliationQueueItem item = reconciliationQueueService.getById(itemId);
        if (item == null) {
            throw new IllegalArgumentException("Reconciliation item not found: " + itemId);
        }
        if (Boolean.TRUE.equals(item.getResolved())) {
            return "already resolved";
        }

        try {
            String notes = repair(item);
            reconciliationQueueService.resolve(itemId, notes);
            log.info("[对账已修复] itemId={}, orderId={}, kind={}, notes={}, traceId={}",
                    itemId, item.getOrderId(), item.getKind(), notes, TraceIdUtil.getTraceId());
            return notes;
        } catch (RuntimeException e) {
            log.warn("[对账修复失败] itemId={}, orderId={}, kind={}, errorMsg={}, traceId={}",
                    itemId, item.getOrderId(), item.getKind(), e.getMessage(), TraceIdUtil.getTraceId());
            reconciliationQueueService.markRetryFailed(itemId, e.getMessage());
            throw e;
        }
    }

    String repair(ReconciliationQueueItem item) {
        ReconciliationPayload payload = reconciliationQueueService.readPayload(item);
        switch (item.getKind()) {
            case LOYALTY_UPDATE:
                return repairLoyalty(item.getOrderId(), payload);
            case SESSION_TOTALS:
                return repairSessionTotals(item.getOrderId(), payload);
            case INVENTORY_FINALIZE:
                return repairInventory(item.getOrderId());
            case ORDER_FINALIZE:
                return repairOrder(item.getOrderId(), payload);
            case PAYMENT_OUTCOME_UNKNOWN:
                return repairPaymentOutcome(item.getOrderId(), payload);
            default:
                throw new IllegalStateException("Unsupported reconciliation kind " + item.getKind());
        }
    }

    private String repairLoyalty(String orderId, ReconciliationPayload payload) {
        Order order = requireOrder(orderId);
        if (order.getStatus() != OrderStatus.COMPLETED) {
            throw new IllegalStateException("Order " + orderId + " is " + order.getStatus() + ", loyalty not applicable");
        }
        if (loyaltyLedgerService.hasEntriesForOrder(orderId)) {
            return "loyalty already applied";
        }
        loyaltyLedgerService.applyCheckout(payload.getCustomerId(), intOrZero(payload.getPointsRedeemed()),
                intOrZero(payload.getPointsEarned()), orderId);
        return "loyalty applied: spent " + intOrZero(payload.getPointsRedeemed())
                + ", earned " + intOrZero(payload.getPointsEarned());
    }

    private String repairSessionTotals(String orderId, ReconciliationPayload payload) {
        boolean recorded = sessionTotalsService.recordPayment(payload.getSessionId(), orderId,
                amountOrZero(payload.getCashAmount()), amountOrZero(payload.getCardAmount()));
        return recorded ? "session totals recorded" : "session totals already recorded";
    }

    private String repairInventory(String orderId) {
        int finalized = inventoryReservationService.finalizeForOrder(orderId);
        return "finalized " + finalized + " reservation(s)";
    }

    private String repairOrder(String orderId, ReconciliationPayload payload) {
        Order order = requireOrder(orderId);
        if (order.getStatus() == OrderStatus.CANCELLED) {
            throw new IllegalStateException("Order " + orderId + " was cancelled after a successful payment");
        }
        if (order.getStatus() == OrderStatus.PENDING) {
            order.setStatus(OrderStatus.COMPLETED);
            order.setPaymentStatus(PaymentStatus.PAID);
            orderLedgerService.completeWithoutInventory(orderId, CheckoutResult.completed(order), payload.getPayments());
        }
        int finalized = inventoryReservationService.finalizeForOrder(orderId);
        return "order completed, finalized " + finalized + " reservation(s)";
    }

    private String repairPaymentOutcome(String orderId, ReconciliationPayload payload) {
        ChargeResult result = paymentGateway.lookup(payload.getIdempotencyKey());
        if (result.getOutcome() == ChargeOutcome.UNKNOWN) {
            throw new IllegalStateException("Gateway has no outcome yet for key " + payload.getIdempotencyKey());
        }
        if (result.getOutcome() != ChargeOutcome.APPROVED) {
            return "no capture: " + result.getOutcome();
        }
        // the order was cancelled, so a late capture is returned to the customer
        paymentGateway.voidCharge(result.getReferenceId());
        orderLedgerService.markRefunded(orderId, result.getReferenceId());
        return "late capture voided: " + result.getReferenceId();
    }

    private Order requireOrder(String orderId) {
        Order order = orderLedgerService.getById(orderId);
        if (order == null) {
            throw new IllegalStateException("Order not found: " + orderId);
        }
        return order;
    }

    private static int intOrZero(Integer value) {
        return value == null ? 0 : value;
    }

    private static BigDecimal amountOrZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
