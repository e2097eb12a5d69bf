package com.pos.checkout.task;

import com.pos.checkout.AbstractLedgerIntegrationTest;
import com.pos.checkout.domain.InventoryReservation;
import com.pos.checkout.domain.Order;
import com.pos.checkout.domain.OrderStatus;
import com.pos.checkout.domain.PaymentMethod;
import com.pos.checkout.domain.PaymentStatus;
import com.pos.checkout.domain.ReconciliationKind;
import com.pos.checkout.domain.ReconciliationQueueItem;
import com.pos.checkout.domain.ReservationStatus;
import com.pos.checkout.dto.CheckoutItem;
import com.pos.checkout.dto.CheckoutResult;
import com.pos.checkout.dto.ReconciliationPayload;
import com.pos.checkout.service.IInventoryReservationService;
import com.pos.checkout.service.IOrderLedgerService;
import com.pos.checkout.service.IReconciliationQueueService;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@Slf4j
class ReservationSweepTaskTest extends AbstractLedgerIntegrationTest {

    private static final String LOCATION_ID = "store-sweep";

    @Autowired
    private ReservationSweepTask reservationSweepTask;

    @Autowired
    private IOrderLedgerService orderLedgerService;

    @Autowired
    private IInventoryReservationService inventoryReservationService;

    @Autowired
    private IReconciliationQueueService reconciliationQueueService;

    @Test
    void staleCardDraftIsCancelledAndQueuedForPaymentCheck() {
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        Order draft = staleDraft(PaymentMethod.CARD);
        orderLedgerService.createDraftWithReservations(draft, items(productId, 2));
        assertThat(inventoryReservationService.availableQuantity(productId, LOCATION_ID)).isEqualByComparingTo("3");

        ReservationSweepTask.SweepResult result = reservationSweepTask.sweepOnce();

        assertThat(result.getAbandonedOrders()).isGreaterThanOrEqualTo(1);
        Order order = orderLedgerService.getById(draft.getId());
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(order.getResultPayload()).contains("InternalError");
        assertThat(reservationsOf(draft.getId()))
                .allSatisfy(r -> {
                    assertThat(r.getStatus()).isEqualTo(ReservationStatus.RELEASED);
                    assertThat(r.getReleaseReason()).isEqualTo("stale_order");
                });
        assertThat(inventoryReservationService.availableQuantity(productId, LOCATION_ID)).isEqualByComparingTo("5");
        assertThat(reconciliationCount(draft.getId(), ReconciliationKind.PAYMENT_OUTCOME_UNKNOWN)).isEqualTo(1);
    }

    @Test
    void staleCashDraftNeedsNoPaymentCheck() {
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        Order draft = staleDraft(PaymentMethod.CASH);
        orderLedgerService.createDraftWithReservations(draft, items(productId, 1));

        reservationSweepTask.sweepOnce();

        assertThat(orderLedgerService.getById(draft.getId()).getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(reconciliationOf(draft.getId())).isEmpty();
    }

    @Test
    void draftAwaitingFinalizeRepairIsLeftAlone() {
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        Order draft = staleDraft(PaymentMethod.CARD);
        orderLedgerService.createDraftWithReservations(draft, items(productId, 1));
        reconciliationQueueService.enqueue(draft.getId(), ReconciliationKind.ORDER_FINALIZE,
                ReconciliationPayload.builder().errorMessage("finalize failed").build());
        expireReservationsOf(draft.getId());

        reservationSweepTask.sweepOnce();

        assertThat(orderLedgerService.getById(draft.getId()).getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(reservationsOf(draft.getId()))
                .extracting(InventoryReservation::getStatus)
                .containsOnly(ReservationStatus.ACTIVE);
        orderLedgerService.discardDraft(draft.getId(), "test_cleanup");
    }

    @Test
    void paidOrderKeepsItsHoldsUntilInventoryRepair() {
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        Order draft = staleDraft(PaymentMethod.CARD);
        orderLedgerService.createDraftWithReservations(draft, items(productId, 2));
        draft.setStatus(OrderStatus.COMPLETED);
        draft.setPaymentStatus(PaymentStatus.PAID);
        assertThat(orderLedgerService.completeWithoutInventory(draft.getId(), CheckoutResult.completed(draft),
                Collections.emptyList())).isTrue();
        ReconciliationQueueItem repair = reconciliationQueueService.enqueue(draft.getId(),
                ReconciliationKind.INVENTORY_FINALIZE,
                ReconciliationPayload.builder().errorMessage("deduction failed").build());
        expireReservationsOf(draft.getId());

        ReservationSweepTask.SweepResult result = reservationSweepTask.sweepOnce();

        log.info("本次清理过期预留数: {}", result.getExpiredReservations());
        assertThat(reservationsOf(draft.getId()))
                .extracting(InventoryReservation::getStatus)
                .containsOnly(ReservationStatus.ACTIVE);
        assertThat(inventoryReservationService.availableQuantity(productId, LOCATION_ID)).isEqualByComparingTo("3");

        assertThat(inventoryReservationService.finalizeForOrder(draft.getId())).isEqualTo(1);
        assertThat(onHand(productId, LOCATION_ID)).isEqualByComparingTo("3");
        assertThat(inventoryReservationService.availableQuantity(productId, LOCATION_ID)).isEqualByComparingTo("3");
        reconciliationQueueService.resolve(repair.getId(), "test_cleanup");
    }

    @Test
    void recentDraftIsNotTouched() {
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        Order draft = staleDraft(PaymentMethod.CASH);
        draft.setCreateTime(LocalDateTime.now());
        orderLedgerService.createDraftWithReservations(draft, items(productId, 1));

        reservationSweepTask.sweepOnce();

        assertThat(orderLedgerService.getById(draft.getId()).getStatus()).isEqualTo(OrderStatus.PENDING);
        // leave nothing pending for other sweeps
        orderLedgerService.discardDraft(draft.getId(), "test_cleanup");
    }

    private void expireReservationsOf(String orderId) {
        inventoryReservationService.lambdaUpdate()
                .set(InventoryReservation::getExpiresAt, LocalDateTime.now().minusMinutes(1))
                .eq(InventoryReservation::getOrderId, orderId)
                .update();
    }

    private Order staleDraft(PaymentMethod paymentMethod) {
        LocalDateTime createdAt = LocalDateTime.now().minusMinutes(20);
        return Order.builder()
                .id(UUID.randomUUID().toString())
                .orderNumber("ORD-" + System.currentTimeMillis() + "-SWEEP1")
                .idempotencyKey(newId("key"))
                .requestFingerprint("fingerprint")
                .vendorId(VENDOR_ID)
                .locationId(LOCATION_ID)
                .status(OrderStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .paymentMethod(paymentMethod)
                .subtotal(new BigDecimal("20.00"))
                .taxAmount(BigDecimal.ZERO)
                .loyaltyDiscountAmount(BigDecimal.ZERO)
                .campaignDiscountAmount(BigDecimal.ZERO)
                .discountAmount(BigDecimal.ZERO)
                .total(new BigDecimal("20.00"))
                .loyaltyPointsRedeemed(0)
                .loyaltyPointsEarned(0)
                .createTime(createdAt)
                .updateTime(createdAt)
                .build();
    }

    private List<CheckoutItem> items(String productId, int quantity) {
        return List.of(CheckoutItem.builder()
                .productId(productId)
                .quantity(quantity)
                .quantityToDeduct(BigDecimal.valueOf(quantity))
                .unitPrice(new BigDecimal("10.00"))
                .build());
    }
}
