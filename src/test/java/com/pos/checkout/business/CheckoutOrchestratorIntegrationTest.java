package com.pos.checkout.business;

import com.pos.checkout.AbstractLedgerIntegrationTest;
import com.pos.checkout.domain.InventoryReservation;
import com.pos.checkout.domain.LoyaltyTransaction;
import com.pos.checkout.domain.LoyaltyTransactionType;
import com.pos.checkout.domain.Order;
import com.pos.checkout.domain.OrderStatus;
import com.pos.checkout.domain.PaymentMethod;
import com.pos.checkout.domain.PaymentStatus;
import com.pos.checkout.domain.PaymentTransaction;
import com.pos.checkout.domain.PaymentTransactionStatus;
import com.pos.checkout.domain.ReconciliationKind;
import com.pos.checkout.domain.ReconciliationQueueItem;
import com.pos.checkout.domain.RegisterSession;
import com.pos.checkout.domain.ReservationStatus;
import com.pos.checkout.dto.CheckoutItem;
import com.pos.checkout.dto.CheckoutRequest;
import com.pos.checkout.dto.CheckoutResult;
import com.pos.checkout.dto.SplitPayment;
import com.pos.checkout.exception.CheckoutErrorKind;
import com.pos.checkout.gateway.ChargeOutcome;
import com.pos.checkout.gateway.ChargeResult;
import com.pos.checkout.gateway.SimulatedPaymentGateway;
import com.pos.checkout.service.IInventoryReservationService;
import com.pos.checkout.service.IOrderLedgerService;
import com.pos.checkout.service.IReconciliationQueueService;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end checkout against the H2 ledger and the simulated gateway
 * - happy paths (cash, split)
 * - payment failures and the unknown-outcome path
 * - idempotent replay, sequential and concurrent
 * - races on the last units of stock and on a full loyalty balance
 * - post-payment failures routed to reconciliation
 */
@Slf4j
class CheckoutOrchestratorIntegrationTest extends AbstractLedgerIntegrationTest {

    private static final String LOCATION_ID = "store-1";

    @Autowired
    private CheckoutOrchestrator checkoutOrchestrator;

    @Autowired
    private SimulatedPaymentGateway paymentGateway;

    @Autowired
    private IOrderLedgerService orderLedgerService;

    @Autowired
    private IInventoryReservationService inventoryReservationService;

    @Autowired
    private IReconciliationQueueService reconciliationQueueService;

    @Autowired
    private ReconciliationRepairService reconciliationRepairService;

    @BeforeEach
    void resetGateway() {
        paymentGateway.reset();
    }

    @AfterEach
    void restoreGateway() {
        paymentGateway.setMode(SimulatedPaymentGateway.Mode.APPROVE);
    }

    @Test
    void cashCheckoutCompletesAndDeductsStock() {
        log.info("====== 测试现金正常结账 ======");
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        String sessionId = openSession(LOCATION_ID);

        CheckoutRequest request = cashRequest(productId, LOCATION_ID, sessionId, 2, "50.00", "10.00");
        CheckoutResult result = checkoutOrchestrator.checkout(request);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.httpStatus()).isEqualTo(200);
        assertThat(result.getStatus()).isEqualTo("completed");
        assertThat(result.getPaymentStatus()).isEqualTo("paid");
        assertThat(result.getTotal()).isEqualByComparingTo("110.00");
        assertThat(result.getOrderNumber()).matches("ORD-\\d+-[A-Z0-9]{6}");

        Order order = orderLedgerService.getById(result.getOrderId());
        assertThat(order.getStatus()).isEqualTo(OrderStatus.COMPLETED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(order.getTotal()).isEqualByComparingTo("110.00");
        assertThat(orderLedgerService.listLines(order.getId())).hasSize(1);

        assertThat(onHand(productId, LOCATION_ID)).isEqualByComparingTo("3");
        assertThat(reservationsOf(order.getId()))
                .extracting(InventoryReservation::getStatus)
                .containsOnly(ReservationStatus.FINALIZED);

        List<PaymentTransaction> payments = orderLedgerService.listPayments(order.getId());
        assertThat(payments).hasSize(1);
        assertThat(payments.get(0).getPaymentMethod()).isEqualTo(PaymentMethod.CASH);
        assertThat(payments.get(0).getProcessorReferenceId()).isEqualTo("CASH-" + order.getOrderNumber());
        assertThat(paymentGateway.invocationCount(request.getIdempotencyKey())).isZero();

        RegisterSession session = sessionTotalsService.getById(sessionId);
        assertThat(session.getTotalSales()).isEqualByComparingTo("110.00");
        assertThat(session.getCashSales()).isEqualByComparingTo("110.00");
        assertThat(session.getTransactionCount()).isEqualTo(1);

        assertThat(reconciliationOf(order.getId())).isEmpty();
    }

    @Test
    void splitCheckoutChargesOnlyTheCardPortion() {
        log.info("====== 测试拆分支付与折扣计算 ======");
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 10);
        String sessionId = openSession(LOCATION_ID);

        CheckoutRequest request = CheckoutRequest.builder()
                .idempotencyKey(newId("key"))
                .vendorId(VENDOR_ID)
                .locationId(LOCATION_ID)
                .sessionId(sessionId)
                .items(List.of(CheckoutItem.builder()
                        .productId(productId)
                        .quantity(2)
                        .quantityToDeduct(new BigDecimal("2"))
                        .unitPrice(new BigDecimal("100.00"))
                        .build()))
                .subtotal(new BigDecimal("200.00"))
                .loyaltyDiscountAmount(new BigDecimal("20.00"))
                .campaignDiscountAmount(new BigDecimal("10.00"))
                .taxAmount(new BigDecimal("17.00"))
                .total(new BigDecimal("187.00"))
                .paymentMethod(PaymentMethod.SPLIT)
                .splitPayment(new SplitPayment(new BigDecimal("130.00"), new BigDecimal("57.00")))
                .build();

        CheckoutResult result = checkoutOrchestrator.checkout(request);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getTotal()).isEqualByComparingTo("187.00");
        assertThat(paymentGateway.invocationCount(request.getIdempotencyKey())).isEqualTo(1);
        ChargeResult charge = paymentGateway.lookup(request.getIdempotencyKey());
        assertThat(charge.getOutcome()).isEqualTo(ChargeOutcome.APPROVED);
        assertThat(charge.getAmount()).isEqualByComparingTo("57.00");

        Order order = orderLedgerService.getById(result.getOrderId());
        assertThat(order.getTotal()).isEqualByComparingTo("187.00");
        assertThat(order.getDiscountAmount()).isEqualByComparingTo("30.00");

        List<PaymentTransaction> payments = orderLedgerService.listPayments(order.getId());
        assertThat(payments).hasSize(2);
        assertThat(payments).extracting(PaymentTransaction::getStatus)
                .containsOnly(PaymentTransactionStatus.APPROVED);
        PaymentTransaction cash = payments.stream()
                .filter(p -> p.getPaymentMethod() == PaymentMethod.CASH).findFirst().orElseThrow();
        PaymentTransaction card = payments.stream()
                .filter(p -> p.getPaymentMethod() == PaymentMethod.CARD).findFirst().orElseThrow();
        assertThat(cash.getAmount()).isEqualByComparingTo("130.00");
        assertThat(card.getAmount()).isEqualByComparingTo("57.00");
        assertThat(card.getProcessorReferenceId()).isEqualTo(charge.getReferenceId());

        RegisterSession session = sessionTotalsService.getById(sessionId);
        assertThat(session.getCashSales()).isEqualByComparingTo("130.00");
        assertThat(session.getCardSales()).isEqualByComparingTo("57.00");
        assertThat(session.getTotalSales()).isEqualByComparingTo("187.00");
    }

    @Test
    void declinedCardCancelsOrderAndReleasesStock() {
        log.info("====== 测试银行卡被拒 ======");
        String productId = newId("product");
        String customerId = newId("customer");
        seedInventory(productId, LOCATION_ID, 3);
        seedLoyalty(customerId, 0);
        paymentGateway.setMode(SimulatedPaymentGateway.Mode.DECLINE);

        CheckoutRequest request = cashRequest(productId, LOCATION_ID, openSession(LOCATION_ID), 1, "45.00", "5.00");
        request.setPaymentMethod(PaymentMethod.CARD);
        request.setCustomerId(customerId);

        CheckoutResult result = checkoutOrchestrator.checkout(request);

        assertThat(result.getErrorKind()).isEqualTo(CheckoutErrorKind.PAYMENT_FAILED);
        assertThat(result.getRetryable()).isTrue();
        assertThat(result.httpStatus()).isEqualTo(402);

        Order order = orderLedgerService.findByIdempotencyKey(request.getIdempotencyKey());
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(reservationsOf(order.getId()))
                .allSatisfy(r -> {
                    assertThat(r.getStatus()).isEqualTo(ReservationStatus.RELEASED);
                    assertThat(r.getReleaseReason()).isEqualTo("payment_failed");
                });
        assertThat(onHand(productId, LOCATION_ID)).isEqualByComparingTo("3");
        assertThat(inventoryReservationService.availableQuantity(productId, LOCATION_ID)).isEqualByComparingTo("3");
        assertThat(loyaltyRowsOf(customerId)).isEmpty();
        assertThat(orderLedgerService.listPayments(order.getId()))
                .extracting(PaymentTransaction::getStatus)
                .containsExactly(PaymentTransactionStatus.DECLINED);
    }

    @Test
    void concurrentCheckoutsForTheLastUnitsSellOnce() throws Exception {
        log.info("====== 测试库存不足竞争 ======");
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 2);
        String sessionId = openSession(LOCATION_ID);

        List<CheckoutRequest> requests = List.of(
                cashRequest(productId, LOCATION_ID, sessionId, 2, "10.00", "1.00"),
                cashRequest(productId, LOCATION_ID, sessionId, 2, "10.00", "1.00"));
        List<CheckoutResult> results = runConcurrently(requests);

        assertThat(results).filteredOn(CheckoutResult::isSuccess).hasSize(1);
        List<CheckoutResult> failures = new ArrayList<>(results);
        failures.removeIf(CheckoutResult::isSuccess);
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0).getErrorKind()).isEqualTo(CheckoutErrorKind.INSUFFICIENT_INVENTORY);
        assertThat(failures.get(0).getRetryable()).isFalse();

        assertThat(onHand(productId, LOCATION_ID)).isZero();
        assertThat(inventoryReservationService.availableQuantity(productId, LOCATION_ID)).isZero();
        long orders = requests.stream()
                .map(r -> orderLedgerService.findByIdempotencyKey(r.getIdempotencyKey()))
                .filter(o -> o != null)
                .count();
        assertThat(orders).isEqualTo(1);
    }

    @Test
    void sequentialReplayReturnsTheStoredResult() {
        log.info("====== 测试顺序重放 ======");
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        CheckoutRequest request = cashRequest(productId, LOCATION_ID, openSession(LOCATION_ID), 1, "20.00", "2.00");
        request.setPaymentMethod(PaymentMethod.CARD);

        CheckoutResult first = checkoutOrchestrator.checkout(request);
        CheckoutResult second = checkoutOrchestrator.checkout(request);
        CheckoutResult third = checkoutOrchestrator.checkout(request);

        assertThat(first.isSuccess()).isTrue();
        assertThat(second).isEqualTo(first);
        assertThat(third).isEqualTo(first);
        assertThat(paymentGateway.invocationCount(request.getIdempotencyKey())).isEqualTo(1);
        assertThat(onHand(productId, LOCATION_ID)).isEqualByComparingTo("4");
        assertThat(orderLedgerService.listPayments(first.getOrderId())).hasSize(1);
    }

    @Test
    void concurrentRequestsWithOneKeyChargeOnce() throws Exception {
        log.info("====== 测试并发重放 ======");
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 10);
        CheckoutRequest request = cashRequest(productId, LOCATION_ID, openSession(LOCATION_ID), 1, "30.00", "3.00");
        request.setPaymentMethod(PaymentMethod.CARD);

        List<CheckoutRequest> requests = Collections.nCopies(8, request);
        List<CheckoutResult> results = runConcurrently(requests);

        CheckoutResult first = results.get(0);
        assertThat(first.isSuccess()).isTrue();
        assertThat(results).allSatisfy(r -> assertThat(r).isEqualTo(first));
        assertThat(paymentGateway.invocationCount(request.getIdempotencyKey())).isEqualTo(1);
        assertThat(orderLedgerService.lambdaQuery()
                .eq(Order::getIdempotencyKey, request.getIdempotencyKey())
                .count()).isEqualTo(1L);
        assertThat(onHand(productId, LOCATION_ID)).isEqualByComparingTo("9");
    }

    @Test
    void reusingAKeyWithADifferentPayloadIsAConflict() {
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        String sessionId = openSession(LOCATION_ID);
        CheckoutRequest original = cashRequest(productId, LOCATION_ID, sessionId, 1, "10.00", "1.00");
        CheckoutRequest altered = cashRequest(productId, LOCATION_ID, sessionId, 2, "10.00", "2.00");
        altered.setIdempotencyKey(original.getIdempotencyKey());

        assertThat(checkoutOrchestrator.checkout(original).isSuccess()).isTrue();
        CheckoutResult result = checkoutOrchestrator.checkout(altered);

        assertThat(result.getErrorKind()).isEqualTo(CheckoutErrorKind.IDEMPOTENCY_CONFLICT);
        assertThat(result.httpStatus()).isEqualTo(409);
        assertThat(result.getRetryable()).isFalse();
        assertThat(onHand(productId, LOCATION_ID)).isEqualByComparingTo("4");
    }

    @Test
    void twoFullBalanceRedemptionsGrantAtMostOne() throws Exception {
        log.info("====== 测试积分并发竞争 ======");
        String productId = newId("product");
        String customerId = newId("customer");
        seedInventory(productId, LOCATION_ID, 10);
        seedLoyalty(customerId, 100);
        String sessionId = openSession(LOCATION_ID);

        List<CheckoutRequest> requests = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            CheckoutRequest request = cashRequest(productId, LOCATION_ID, sessionId, 1, "10.00", "1.00");
            request.setCustomerId(customerId);
            request.setLoyaltyPointsToRedeem(100);
            requests.add(request);
        }
        List<CheckoutResult> results = runConcurrently(requests);

        assertThat(results).filteredOn(CheckoutResult::isSuccess).hasSize(1);
        assertThat(results).filteredOn(r -> r.getErrorKind() == CheckoutErrorKind.INSUFFICIENT_LOYALTY_POINTS)
                .hasSize(1);

        assertThat(loyaltyLedgerService.getAccount(customerId).getPointsBalance()).isZero();
        List<LoyaltyTransaction> rows = loyaltyRowsOf(customerId);
        assertThat(rows).extracting(LoyaltyTransaction::getTransactionType)
                .containsExactlyInAnyOrder(LoyaltyTransactionType.ADJUSTED, LoyaltyTransactionType.SPENT);
        assertThat(rows.stream().mapToInt(LoyaltyTransaction::getPoints).sum()).isZero();
        assertThat(onHand(productId, LOCATION_ID)).isEqualByComparingTo("9");
    }

    @Test
    void loyaltyFailureAfterPaymentIsQueuedNotReturned() {
        log.info("====== 测试支付后积分失败 ======");
        String productId = newId("product");
        String customerId = newId("customer");
        String vendorId = newId("vendor");
        seedInventory(productId, LOCATION_ID, 5);
        seedProgram(vendorId, "1.0");

        CheckoutRequest request = cashRequest(productId, LOCATION_ID, openSession(LOCATION_ID), 1, "40.00", "4.00");
        request.setVendorId(vendorId);
        request.setCustomerId(customerId);

        CheckoutResult result = checkoutOrchestrator.checkout(request);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStatus()).isEqualTo("completed");
        assertThat(result.getPaymentStatus()).isEqualTo("paid");
        assertThat(result.getPointsEarned()).isEqualTo(40);

        List<ReconciliationQueueItem> items = reconciliationOf(result.getOrderId());
        assertThat(items).hasSize(1);
        assertThat(items.get(0).getKind()).isEqualTo(ReconciliationKind.LOYALTY_UPDATE);
        assertThat(items.get(0).getResolved()).isFalse();

        // the account shows up later; the repair applies the earn exactly once
        seedLoyalty(customerId, 0);
        reconciliationRepairService.repairById(items.get(0).getId());
        reconciliationRepairService.repairById(items.get(0).getId());

        assertThat(loyaltyLedgerService.getAccount(customerId).getPointsBalance()).isEqualTo(40);
        assertThat(loyaltyRowsOf(customerId)).hasSize(1);
        assertThat(reconciliationQueueService.getById(items.get(0).getId()).getResolved()).isTrue();
    }

    @Test
    void missingSessionIsQueuedForSessionTotals() {
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        String sessionId = newId("session");

        CheckoutResult result = checkoutOrchestrator.checkout(
                cashRequest(productId, LOCATION_ID, sessionId, 1, "15.00", "1.50"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(reconciliationCount(result.getOrderId(), ReconciliationKind.SESSION_TOTALS)).isEqualTo(1);
        assertThat(reconciliationOf(result.getOrderId())).hasSize(1);

        sessionTotalsService.openSession(sessionId, LOCATION_ID);
        ReconciliationQueueItem item = reconciliationOf(result.getOrderId()).get(0);
        assertThat(reconciliationRepairService.repairById(item.getId())).isEqualTo("session totals recorded");
        assertThat(sessionTotalsService.getById(sessionId).getTotalSales()).isEqualByComparingTo("16.50");
    }

    @Test
    void loyaltyRejectionLeavesNoSideEffects() {
        log.info("====== 测试支付前原子性 ======");
        String firstProduct = newId("product");
        String secondProduct = newId("product");
        String customerId = newId("customer");
        seedInventory(firstProduct, LOCATION_ID, 4);
        seedInventory(secondProduct, LOCATION_ID, 4);
        seedLoyalty(customerId, 10);

        CheckoutRequest request = CheckoutRequest.builder()
                .idempotencyKey(newId("key"))
                .vendorId(VENDOR_ID)
                .locationId(LOCATION_ID)
                .customerId(customerId)
                .items(List.of(
                        unitItem(firstProduct, 2, "5.00"),
                        unitItem(secondProduct, 1, "8.00")))
                .subtotal(new BigDecimal("18.00"))
                .taxAmount(BigDecimal.ZERO)
                .total(new BigDecimal("18.00"))
                .paymentMethod(PaymentMethod.CASH)
                .loyaltyPointsToRedeem(50)
                .build();

        CheckoutResult result = checkoutOrchestrator.checkout(request);

        assertThat(result.getErrorKind()).isEqualTo(CheckoutErrorKind.INSUFFICIENT_LOYALTY_POINTS);
        assertThat(result.httpStatus()).isEqualTo(400);
        assertThat(onHand(firstProduct, LOCATION_ID)).isEqualByComparingTo("4");
        assertThat(onHand(secondProduct, LOCATION_ID)).isEqualByComparingTo("4");
        assertThat(inventoryReservationService.availableQuantity(firstProduct, LOCATION_ID)).isEqualByComparingTo("4");
        assertThat(inventoryReservationService.availableQuantity(secondProduct, LOCATION_ID)).isEqualByComparingTo("4");

        Order order = orderLedgerService.findByIdempotencyKey(request.getIdempotencyKey());
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(reservationsOf(order.getId()))
                .hasSize(2)
                .allSatisfy(r -> assertThat(r.getReleaseReason()).isEqualTo("loyalty_rejected"));
        assertThat(loyaltyLedgerService.getAccount(customerId).getPointsBalance()).isEqualTo(10);
        assertThat(loyaltyRowsOf(customerId)).hasSize(1);
        assertThat(reconciliationOf(order.getId())).isEmpty();
    }

    @Test
    void gatewayTimeoutResolvesAsUnavailableAndLateCaptureIsVoided() throws Exception {
        log.info("====== 测试网关超时 ======");
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        paymentGateway.setMode(SimulatedPaymentGateway.Mode.HANG);
        paymentGateway.setHangMillis(1500);

        CheckoutRequest request = cashRequest(productId, LOCATION_ID, openSession(LOCATION_ID), 1, "25.00", "2.50");
        request.setPaymentMethod(PaymentMethod.CARD);

        CheckoutResult result = checkoutOrchestrator.checkout(request);

        assertThat(result.getErrorKind()).isEqualTo(CheckoutErrorKind.GATEWAY_UNAVAILABLE);
        assertThat(result.httpStatus()).isEqualTo(503);
        assertThat(result.getRetryable()).isTrue();
        assertThat(result.getMessage()).startsWith("Checkout could not be completed. Reference: ");

        Order order = orderLedgerService.findByIdempotencyKey(request.getIdempotencyKey());
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(onHand(productId, LOCATION_ID)).isEqualByComparingTo("5");
        assertThat(inventoryReservationService.availableQuantity(productId, LOCATION_ID)).isEqualByComparingTo("5");

        List<ReconciliationQueueItem> items = reconciliationOf(order.getId());
        assertThat(items).hasSize(1);
        assertThat(items.get(0).getKind()).isEqualTo(ReconciliationKind.PAYMENT_OUTCOME_UNKNOWN);

        // the replay returns the same failure and never charges again
        assertThat(checkoutOrchestrator.checkout(request)).isEqualTo(result);
        assertThat(paymentGateway.invocationCount(request.getIdempotencyKey())).isEqualTo(1);

        // wait for the hung charge to land, then repair
        long deadline = System.currentTimeMillis() + 10_000;
        while (!paymentGateway.lookup(request.getIdempotencyKey()).isApproved()
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(100);
        }
        ChargeResult late = paymentGateway.lookup(request.getIdempotencyKey());
        assertThat(late.isApproved()).isTrue();

        String notes = reconciliationRepairService.repairById(items.get(0).getId());

        assertThat(notes).contains(late.getReferenceId());
        assertThat(paymentGateway.isVoided(late.getReferenceId())).isTrue();
        assertThat(reconciliationQueueService.getById(items.get(0).getId()).getResolved()).isTrue();
        Order refunded = orderLedgerService.getById(order.getId());
        assertThat(refunded.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(refunded.getPaymentStatus()).isEqualTo(PaymentStatus.REFUNDED);
    }

    @Test
    void processorErrorIsPolledAndReportedAsUnavailable() {
        log.info("====== 测试网关处理异常 ======");
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        paymentGateway.setMode(SimulatedPaymentGateway.Mode.ERROR);

        CheckoutRequest request = cashRequest(productId, LOCATION_ID, openSession(LOCATION_ID), 1, "30.00", "3.00");
        request.setPaymentMethod(PaymentMethod.CARD);

        CheckoutResult result = checkoutOrchestrator.checkout(request);

        assertThat(result.getErrorKind()).isEqualTo(CheckoutErrorKind.GATEWAY_UNAVAILABLE);
        assertThat(result.httpStatus()).isEqualTo(503);
        assertThat(result.getRetryable()).isTrue();
        assertThat(paymentGateway.invocationCount(request.getIdempotencyKey())).isEqualTo(1);

        Order order = orderLedgerService.findByIdempotencyKey(request.getIdempotencyKey());
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELLED);
        assertThat(order.getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
        assertThat(inventoryReservationService.availableQuantity(productId, LOCATION_ID)).isEqualByComparingTo("5");
        assertThat(orderLedgerService.listPayments(order.getId()))
                .extracting(PaymentTransaction::getStatus)
                .containsExactly(PaymentTransactionStatus.ERROR);

        List<ReconciliationQueueItem> items = reconciliationOf(order.getId());
        assertThat(items).extracting(ReconciliationQueueItem::getKind)
                .containsExactly(ReconciliationKind.PAYMENT_OUTCOME_UNKNOWN);

        // the gateway confirms nothing was captured
        String notes = reconciliationRepairService.repairById(items.get(0).getId());
        assertThat(notes).isEqualTo("no capture: ERROR");
        assertThat(orderLedgerService.getById(order.getId()).getPaymentStatus()).isEqualTo(PaymentStatus.FAILED);
    }

    @Test
    void repairOfAnUnknownOutcomeIsDeferredWhileTheGatewayHasNoAnswer() {
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        paymentGateway.setMode(SimulatedPaymentGateway.Mode.HANG);
        paymentGateway.setHangMillis(3000);

        CheckoutRequest request = cashRequest(productId, LOCATION_ID, openSession(LOCATION_ID), 1, "12.00", "1.20");
        request.setPaymentMethod(PaymentMethod.CARD);
        CheckoutResult result = checkoutOrchestrator.checkout(request);
        assertThat(result.getErrorKind()).isEqualTo(CheckoutErrorKind.GATEWAY_UNAVAILABLE);

        Order order = orderLedgerService.findByIdempotencyKey(request.getIdempotencyKey());
        ReconciliationQueueItem item = reconciliationOf(order.getId()).get(0);

        assertThatThrownBy(() -> reconciliationRepairService.repairById(item.getId()))
                .isInstanceOf(IllegalStateException.class);
        ReconciliationQueueItem after = reconciliationQueueService.getById(item.getId());
        assertThat(after.getResolved()).isFalse();
        assertThat(after.getRetryCount()).isEqualTo(1);
        assertThat(after.getLastError()).contains("no outcome");
    }

    @Test
    void pointsBeyondTheBalanceRangeAreRejectedBeforeAnySideEffect() {
        String productId = newId("product");
        String customerId = newId("customer");
        String vendorId = newId("vendor");
        seedInventory(productId, LOCATION_ID, 5);
        seedLoyalty(customerId, 0);
        seedProgram(vendorId, "1.0");

        CheckoutRequest request = cashRequest(productId, LOCATION_ID, null, 1, "3000000000.00", "0.00");
        request.setVendorId(vendorId);
        request.setCustomerId(customerId);

        CheckoutResult result = checkoutOrchestrator.checkout(request);

        assertThat(result.getErrorKind()).isEqualTo(CheckoutErrorKind.VALIDATION_ERROR);
        assertThat(result.httpStatus()).isEqualTo(400);
        assertThat(result.getMessage()).contains("exceed the largest loyalty balance");
        assertThat(orderLedgerService.findByIdempotencyKey(request.getIdempotencyKey())).isNull();
        assertThat(inventoryReservationService.availableQuantity(productId, LOCATION_ID)).isEqualByComparingTo("5");
        assertThat(loyaltyRowsOf(customerId)).isEmpty();
    }

    @Test
    void tieredLineDeductsItsTierQuantityNotTheCartQuantity() {
        log.info("====== 测试重量档位扣减 ======");
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, new BigDecimal("28"));

        CheckoutRequest request = cashRequest(productId, LOCATION_ID, null, 2, "35.00", "0.00");
        CheckoutItem line = request.getItems().get(0);
        line.setTierName("3.5g (Eighth)");
        line.setQuantityToDeduct(new BigDecimal("7.0"));

        CheckoutResult result = checkoutOrchestrator.checkout(request);

        assertThat(result.isSuccess()).isTrue();
        assertThat(onHand(productId, LOCATION_ID)).isEqualByComparingTo("21");
        assertThat(orderLedgerService.listLines(result.getOrderId()))
                .singleElement()
                .satisfies(orderLine -> {
                    assertThat(orderLine.getQuantity()).isEqualTo(2);
                    assertThat(orderLine.getTierName()).isEqualTo("3.5g (Eighth)");
                    assertThat(orderLine.getQuantityToDeduct()).isEqualByComparingTo("7");
                    assertThat(orderLine.getLineTotal()).isEqualByComparingTo("70.00");
                });
    }

    @Test
    void lineWithoutDeductQuantityIsRejected() {
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, new BigDecimal("28"));
        CheckoutRequest request = cashRequest(productId, LOCATION_ID, null, 1, "180.00", "0.00");
        request.getItems().get(0).setTierName("28g (Ounce)");
        request.getItems().get(0).setQuantityToDeduct(null);

        CheckoutResult result = checkoutOrchestrator.checkout(request);

        assertThat(result.getErrorKind()).isEqualTo(CheckoutErrorKind.VALIDATION_ERROR);
        assertThat(result.getMessage()).contains("quantityToDeduct");
        assertThat(onHand(productId, LOCATION_ID)).isEqualByComparingTo("28");
        assertThat(orderLedgerService.findByIdempotencyKey(request.getIdempotencyKey())).isNull();
    }

    @Test
    void invalidRequestIsRejectedBeforeAnySideEffect() {
        String productId = newId("product");
        seedInventory(productId, LOCATION_ID, 5);
        CheckoutRequest request = cashRequest(productId, LOCATION_ID, null, 1, "10.00", "1.00");
        request.setTotal(new BigDecimal("99.00"));

        CheckoutResult result = checkoutOrchestrator.checkout(request);

        assertThat(result.getErrorKind()).isEqualTo(CheckoutErrorKind.VALIDATION_ERROR);
        assertThat(result.httpStatus()).isEqualTo(400);
        assertThat(orderLedgerService.findByIdempotencyKey(request.getIdempotencyKey())).isNull();
        assertThat(inventoryReservationService.availableQuantity(productId, LOCATION_ID)).isEqualByComparingTo("5");
    }

    private List<CheckoutResult> runConcurrently(List<CheckoutRequest> requests) throws Exception {
        ExecutorService executorService = Executors.newFixedThreadPool(requests.size());
        CountDownLatch ready = new CountDownLatch(requests.size());
        CountDownLatch start = new CountDownLatch(1);
        List<Future<CheckoutResult>> futures = new ArrayList<>();
        try {
            for (CheckoutRequest request : requests) {
                futures.add(executorService.submit(() -> {
                    ready.countDown();
                    start.await();
                    return checkoutOrchestrator.checkout(request);
                }));
            }
            ready.await(5, TimeUnit.SECONDS);
            start.countDown();
            List<CheckoutResult> results = new ArrayList<>();
            for (Future<CheckoutResult> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS));
            }
            return results;
        } finally {
            executorService.shutdownNow();
        }
    }
}
