package com.pos.checkout.business;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pos.checkout.config.CheckoutProperties;
import com.pos.checkout.domain.Order;
import com.pos.checkout.domain.OrderStatus;
import com.pos.checkout.domain.PaymentMethod;
import com.pos.checkout.domain.PaymentStatus;
import com.pos.checkout.domain.PaymentTransaction;
import com.pos.checkout.domain.ReconciliationKind;
import com.pos.checkout.dto.CheckoutRequest;
import com.pos.checkout.dto.CheckoutResult;
import com.pos.checkout.dto.ReconciliationPayload;
import com.pos.checkout.exception.CheckoutErrorKind;
import com.pos.checkout.exception.CheckoutException;
import com.pos.checkout.exception.InsufficientStockException;
import com.pos.checkout.service.ILoyaltyLedgerService;
import com.pos.checkout.service.IOrderLedgerService;
import com.pos.checkout.service.IReconciliationQueueService;
import com.pos.checkout.service.ISessionTotalsService;
import com.pos.checkout.util.CheckoutResultCache;
import com.pos.checkout.util.DistributedLockUtil;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * 结账编排器
 * <p>
 * 每个结账请求调用一次，同一幂等键只执行一次：
 * 1. 校验请求
 * 2. 幂等检查（已完结的订单直接重放，处理中的请求等待其结果）
 * 3. 在同一事务中创建 PENDING 草稿订单并预留库存
 * 4. 写入订单明细
 * 5. 冻结待抵扣的积分
 * 6. 支付（不持有任何数据库锁）
 * 7. 完成订单并扣减库存
 * 8. 积分抵扣与获取入账
 * 9. 更新收银会话汇总
 * <p>
 * 第 6 步之前失败不留下任何数据。支付成功后的失败不会让结账失败，而是写入对账队列。
 * 该方法从不抛出异常：所有结果都是 CheckoutResult。
 */
@Slf4j
@Service
public class CheckoutOrchestrator {

    private static final String LOCK_PREFIX = "checkout:";
    private static final int CONFLICT_LOOKUP_ATTEMPTS = 10;
    private static final String ORDER_NUMBER_ALPHABET = "ABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789";

    static final String REASON_ORDER_CREATION_FAILED = "order_creation_failed";
    static final String REASON_LOYALTY_REJECTED = "loyalty_rejected";
    static final String REASON_PAYMENT_FAILED = "payment_failed";
    static final String REASON_PAYMENT_UNKNOWN = "payment_unknown";
    static final String REASON_STALE_ORDER = "stale_order";

    private final CheckoutRequestValidator requestValidator;
    private final PaymentCoordinator paymentCoordinator;
    private final IOrderLedgerService orderLedgerService;
    private final ILoyaltyLedgerService loyaltyLedgerService;
    private final ISessionTotalsService sessionTotalsService;
    private final IReconciliationQueueService reconciliationQueueService;
    private final CheckoutResultCache checkoutResultCache;
    private final CheckoutProperties checkoutProperties;
    private final ObjectMapper objectMapper;

    public CheckoutOrchestrator(CheckoutRequestValidator requestValidator,
                                PaymentCoordinator paymentCoordinator,
                                IOrderLedgerService orderLedgerService,
                                ILoyaltyLedgerService loyaltyLedgerService,
                                ISessionTotalsService sessionTotalsService,
                                IReconciliationQueueService reconciliationQueueService,
                                CheckoutResultCache checkoutResultCache,
                                CheckoutProperties checkoutProperties,
                                ObjectMapper objectMapper) {
        this.requestValidator = requestValidator;
        this.paymentCoordinator = paymentCoordinator;
        this.orderLedgerService = orderLedgerService;
        this.loyaltyLedgerService = loyaltyLedgerService;
        this.sessionTotalsService = sessionTotalsService;
        this.reconciliationQueueService = reconciliationQueueService;
        this.checkoutResultCache = checkoutResultCache;
        this.checkoutProperties = checkoutProperties;
        this.objectMapper = objectMapper;
    }

    public CheckoutResult checkout(CheckoutRequest request) {
        String traceId = TraceIdUtil.getTraceId();

        // ==================== 1. Validate ====================
        try {
            requestValidator.validate(request);
        } catch (CheckoutException e) {
            log.warn("[结账被拒绝] reason={}, traceId={}", e.getMessage(), traceId);
            return CheckoutResult.failure(e.getKind(), e.getMessage(), traceId);
        }

        String idempotencyKey = request.getIdempotencyKey();
        String fingerprint;
        try {
            fingerprint = fingerprint(request);
        } catch (JsonProcessingException e) {
            log.error("[请求指纹计算失败] idempotencyKey={}, traceId={}", idempotencyKey, traceId, e);
            return CheckoutResult.failure(CheckoutErrorKind.INTERNAL_ERROR, e.getMessage(), traceId);
        }

        // ==================== 2. Replay cache ====================
        CheckoutResultCache.CachedResult cached = checkoutResultCache.get(idempotencyKey);
        if (cached != null) {
            if (fingerprint.equals(cached.getFingerprint())) {
                log.info("[结账从缓存重放] idempotencyKey={}, traceId={}", idempotencyKey, traceId);
                return cached.getResult();
            }
            return conflict(idempotencyKey);
        }

        // ==================== 3. Single orchestrator per key ====================
        String lockKey = LOCK_PREFIX + idempotencyKey;
        long deadline = System.currentTimeMillis() + checkoutProperties.getReplayWait().toMillis();
        while (!DistributedLockUtil.tryLock(lockKey, 0,
                checkoutProperties.getIdempotencyLockLease().toMillis(), TimeUnit.MILLISECONDS)) {
            Order inFlight = orderLedgerService.findByIdempotencyKey(idempotencyKey);
            if (inFlight != null && inFlight.isResolved()) {
                return replay(inFlight, fingerprint);
            }
            if (System.currentTimeMillis() >= deadline || !pause()) {
                return inProgress(idempotencyKey);
            }
        }

        try {
            return execute(request, fingerprint, traceId);
        } catch (Exception e) {
            log.error("[结账异常] idempotencyKey={}, errorMsg={}, traceId={}",
                    idempotencyKey, e.getMessage(), traceId, e);
            return CheckoutResult.failure(CheckoutErrorKind.INTERNAL_ERROR, e.getMessage(), traceId);
        } finally {
            DistributedLockUtil.unlock(lockKey);
        }
    }

    private CheckoutResult execute(CheckoutRequest request, String fingerprint, String traceId) {
        String idempotencyKey = request.getIdempotencyKey();

        // ==================== IDEMPOTENCY_CHECK ====================
        Order existing = orderLedgerService.findByIdempotencyKey(idempotencyKey);
        if (existing != null) {
            return awaitAndReplay(existing, fingerprint);
        }

        Order draft;
        try {
            draft = buildDraft(request, fingerprint, traceId);
        } catch (CheckoutException e) {
            log.warn("[结账被拒绝] reason={}, traceId={}", e.getMessage(), traceId);
            return CheckoutResult.failure(e.getKind(), e.getMessage(), traceId);
        }
        String orderId = draft.getId();
        log.info("[结账开始] orderId={}, orderNumber={}, idempotencyKey={}, total={}, method={}, traceId={}",
                orderId, draft.getOrderNumber(), idempotencyKey, draft.getTotal(), draft.getPaymentMethod(), traceId);

        // ==================== RESERVE_INVENTORY + CREATE_DRAFT_ORDER ====================
        try {
            orderLedgerService.createDraftWithReservations(draft, request.getItems());
        } catch (InsufficientStockException e) {
            log.warn("[结账被拒绝] insufficient inventory, productId={}, requested={}, available={}, traceId={}",
                    e.getProductId(), e.getRequested(), e.getAvailable(), traceId);
            return CheckoutResult.failure(e.getKind(), e.getMessage(), traceId);
        } catch (DuplicateKeyException | ConcurrencyFailureException e) {
            Order winner = findCommitted(idempotencyKey);
            if (winner != null) {
                log.info("[等待进行中的结账请求] idempotencyKey={}, orderId={}, traceId={}",
                        idempotencyKey, winner.getId(), traceId);
                return awaitAndReplay(winner, fingerprint);
            }
            log.warn("[草稿订单创建冲突] idempotencyKey={}, errorMsg={}, traceId={}",
                    idempotencyKey, e.getMessage(), traceId);
            return CheckoutResult.failure(CheckoutErrorKind.ORDER_CREATION_FAILED, e.getMessage(), traceId);
        } catch (Exception e) {
            log.error("[草稿订单创建失败] idempotencyKey={}, errorMsg={}, traceId={}",
                    idempotencyKey, e.getMessage(), traceId, e);
            return CheckoutResult.failure(CheckoutErrorKind.ORDER_CREATION_FAILED, e.getMessage(), traceId);
        }

        // ==================== INSERT_ORDER_LINES ====================
        try {
            orderLedgerService.insertLines(orderId, request.getItems());
        } catch (Exception e) {
            log.error("[订单明细写入失败] orderId={}, errorMsg={}, traceId={}", orderId, e.getMessage(), traceId, e);
            discardQuietly(orderId);
            return CheckoutResult.failure(CheckoutErrorKind.ORDER_CREATION_FAILED, e.getMessage(), traceId);
        }

        // ==================== VALIDATE_LOYALTY_REDEMPTION ====================
        if (request.pointsToRedeem() > 0) {
            try {
                loyaltyLedgerService.placeHold(request.getCustomerId(), request.pointsToRedeem(), orderId);
            } catch (CheckoutException e) {
                CheckoutResult result = CheckoutResult.failure(CheckoutErrorKind.INSUFFICIENT_LOYALTY_POINTS,
                        e.getMessage(), traceId);
                cancelQuietly(orderId, REASON_LOYALTY_REJECTED, result, Collections.emptyList());
                return finish(idempotencyKey, fingerprint, result);
            } catch (Exception e) {
                log.error("[积分冻结失败] orderId={}, errorMsg={}, traceId={}", orderId, e.getMessage(), traceId, e);
                CheckoutResult result = CheckoutResult.failure(CheckoutErrorKind.INTERNAL_ERROR, e.getMessage(), traceId);
                cancelQuietly(orderId, REASON_LOYALTY_REJECTED, result, Collections.emptyList());
                return finish(idempotencyKey, fingerprint, result);
            }
        }

        // ==================== PROCESS_PAYMENT ====================
        PaymentOutcome payment = paymentCoordinator.process(draft, request);
        if (payment.getStatus() == PaymentOutcome.Status.DECLINED) {
            CheckoutResult result = CheckoutResult.failure(CheckoutErrorKind.PAYMENT_FAILED,
                    "Payment declined: " + payment.getReason(), traceId);
            cancelQuietly(orderId, REASON_PAYMENT_FAILED, result, payment.getTransactions());
            log.warn("[结账支付失败] orderId={}, reason={}, traceId={}", orderId, payment.getReason(), traceId);
            return finish(idempotencyKey, fingerprint, result);
        }
        if (payment.getStatus() == PaymentOutcome.Status.UNKNOWN) {
            CheckoutResult result = CheckoutResult.failure(CheckoutErrorKind.GATEWAY_UNAVAILABLE,
                    payment.getReason(), traceId);
            cancelQuietly(orderId, REASON_PAYMENT_UNKNOWN, result, payment.getTransactions());
            enqueueQuietly(orderId, ReconciliationKind.PAYMENT_OUTCOME_UNKNOWN, ReconciliationPayload.builder()
                    .idempotencyKey(idempotencyKey)
                    .amount(payment.getCardAmount())
                    .errorMessage(payment.getReason())
                    .build());
            return finish(idempotencyKey, fingerprint, result);
        }

        // Paid. Nothing below may turn this into a failure.
        draft.setStatus(OrderStatus.COMPLETED);
        draft.setPaymentStatus(PaymentStatus.PAID);
        CheckoutResult result = CheckoutResult.completed(draft);

        // ==================== FINALIZE_ORDER + FINALIZE_INVENTORY ====================
        finalizeOrder(orderId, result, payment);

        // ==================== UPDATE_LOYALTY ====================
        if (StringUtils.hasText(request.getCustomerId())
                && (draft.getLoyaltyPointsRedeemed() > 0 || draft.getLoyaltyPointsEarned() > 0)) {
            try {
                loyaltyLedgerService.applyCheckout(request.getCustomerId(), draft.getLoyaltyPointsRedeemed(),
                        draft.getLoyaltyPointsEarned(), orderId);
            } catch (Exception e) {
                log.warn("[支付后积分更新失败] orderId={}, customerId={}, errorMsg={}, traceId={}",
                        orderId, request.getCustomerId(), e.getMessage(), traceId);
                enqueueQuietly(orderId, ReconciliationKind.LOYALTY_UPDATE, ReconciliationPayload.builder()
                        .customerId(request.getCustomerId())
                        .pointsEarned(draft.getLoyaltyPointsEarned())
                        .pointsRedeemed(draft.getLoyaltyPointsRedeemed())
                        .orderTotal(draft.getTotal())
                        .errorMessage(e.getMessage())
                        .build());
            }
        }

        // ==================== UPDATE_SESSION_TOTALS ====================
        if (StringUtils.hasText(request.getSessionId())) {
            try {
                sessionTotalsService.recordPayment(request.getSessionId(), orderId,
                        payment.getCashAmount(), payment.getCardAmount());
            } catch (Exception e) {
                log.warn("[支付后会话汇总失败] orderId={}, sessionId={}, errorMsg={}, traceId={}",
                        orderId, request.getSessionId(), e.getMessage(), traceId);
                enqueueQuietly(orderId, ReconciliationKind.SESSION_TOTALS, ReconciliationPayload.builder()
                        .sessionId(request.getSessionId())
                        .cashAmount(payment.getCashAmount())
                        .cardAmount(payment.getCardAmount())
                        .errorMessage(e.getMessage())
                        .build());
            }
        }

        log.info("[结账完成] orderId={}, orderNumber={}, total={}, pointsEarned={}, pointsRedeemed={}, traceId={}",
                orderId, draft.getOrderNumber(), draft.getTotal(), draft.getLoyaltyPointsEarned(),
                draft.getLoyaltyPointsRedeemed(), traceId);
        return finish(idempotencyKey, fingerprint, result);
    }

    /**
     * Cancels a PENDING order left behind by a crashed checkout.
     *
     * @return false when the order was skipped or already resolved
     */
    public boolean abandonStaleDraft(Order order) {
        String traceId = TraceIdUtil.getTraceId();
        if (reconciliationQueueService.hasUnresolved(order.getId(), ReconciliationKind.ORDER_FINALIZE)) {
            // paid, waiting for finalization
            log.info("[跳过过期草稿订单] orderId={}, awaiting ORDER_FINALIZE repair", order.getId());
            return false;
        }

        CheckoutResult result = CheckoutResult.failure(CheckoutErrorKind.INTERNAL_ERROR,
                "Checkout abandoned before completion", order.getTraceId());
        if (!orderLedgerService.cancel(order.getId(), REASON_STALE_ORDER, result, Collections.emptyList())) {
            return false;
        }
        log.warn("[过期草稿订单已取消] orderId={}, createTime={}, method={}, traceId={}",
                order.getId(), order.getCreateTime(), order.getPaymentMethod(), traceId);

        if (order.getPaymentMethod() != PaymentMethod.CASH) {
            // the crash may have happened after the gateway captured
            enqueueQuietly(order.getId(), ReconciliationKind.PAYMENT_OUTCOME_UNKNOWN, ReconciliationPayload.builder()
                    .idempotencyKey(order.getIdempotencyKey())
                    .errorMessage("Checkout abandoned while pending")
                    .build());
        }
        return true;
    }

    private void finalizeOrder(String orderId, CheckoutResult result, PaymentOutcome payment) {
        String traceId = TraceIdUtil.getTraceId();
        try {
            orderLedgerService.complete(orderId, result, payment.getTransactions());
            return;
        } catch (Exception e) {
            log.warn("[支付后订单确认失败] orderId={}, errorMsg={}, traceId={}",
                    orderId, e.getMessage(), traceId);
        }

        try {
            if (orderLedgerService.completeWithoutInventory(orderId, result, payment.getTransactions())) {
                enqueueQuietly(orderId, ReconciliationKind.INVENTORY_FINALIZE, ReconciliationPayload.builder()
                        .errorMessage("Inventory deduction failed after payment")
                        .build());
                return;
            }
            log.error("[支付后订单已被并发处理] orderId={}, traceId={}", orderId, traceId);
            enqueueQuietly(orderId, ReconciliationKind.ORDER_FINALIZE, ReconciliationPayload.builder()
                    .payments(payment.getTransactions())
                    .errorMessage("Order was no longer pending when payment completed")
                    .build());
        } catch (Exception e) {
            log.warn("[支付后订单完成失败] orderId={}, errorMsg={}, traceId={}",
                    orderId, e.getMessage(), traceId);
            enqueueQuietly(orderId, ReconciliationKind.ORDER_FINALIZE, ReconciliationPayload.builder()
                    .payments(payment.getTransactions())
                    .errorMessage(e.getMessage())
                    .build());
        }
    }

    /**
     * The competing draft may not be visible yet when the key conflict surfaces as a lock failure.
     */
    private Order findCommitted(String idempotencyKey) {
        for (int attempt = 0; attempt < CONFLICT_LOOKUP_ATTEMPTS; attempt++) {
            Order order = orderLedgerService.findByIdempotencyKey(idempotencyKey);
            if (order != null || !pause()) {
                return order;
            }
        }
        return null;
    }

    private CheckoutResult awaitAndReplay(Order order, String fingerprint) {
        if (!fingerprint.equals(order.getRequestFingerprint())) {
            return conflict(order.getIdempotencyKey());
        }
        long deadline = System.currentTimeMillis() + checkoutProperties.getReplayWait().toMillis();
        Order current = order;
        while (!current.isResolved()) {
            if (System.currentTimeMillis() >= deadline || !pause()) {
                return inProgress(order.getIdempotencyKey());
            }
            current = orderLedgerService.findByIdempotencyKey(order.getIdempotencyKey());
            if (current == null) {
                // draft discarded by a pre-payment failure; the client may retry
                return inProgress(order.getIdempotencyKey());
            }
        }
        return replay(current, fingerprint);
    }

    private CheckoutResult replay(Order order, String fingerprint) {
        if (!fingerprint.equals(order.getRequestFingerprint())) {
            return conflict(order.getIdempotencyKey());
        }
        try {
            CheckoutResult stored = objectMapper.readValue(order.getResultPayload(), CheckoutResult.class);
            log.info("[结账重放] idempotencyKey={}, orderId={}, status={}, traceId={}",
                    order.getIdempotencyKey(), order.getId(), order.getStatus(), TraceIdUtil.getTraceId());
            checkoutResultCache.put(order.getIdempotencyKey(), fingerprint, stored);
            return stored;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("[已存结果无法解析] orderId={}, traceId={}", order.getId(), TraceIdUtil.getTraceId(), e);
            return CheckoutResult.failure(CheckoutErrorKind.INTERNAL_ERROR, e.getMessage(), TraceIdUtil.getTraceId());
        }
    }

    private CheckoutResult conflict(String idempotencyKey) {
        log.warn("[幂等冲突] idempotencyKey={}, traceId={}", idempotencyKey, TraceIdUtil.getTraceId());
        return CheckoutResult.failure(CheckoutErrorKind.IDEMPOTENCY_CONFLICT,
                "Idempotency key " + idempotencyKey + " was already used for a different request",
                TraceIdUtil.getTraceId());
    }

    private CheckoutResult inProgress(String idempotencyKey) {
        log.warn("[结账仍在处理中] idempotencyKey={}, traceId={}", idempotencyKey, TraceIdUtil.getTraceId());
        return CheckoutResult.failure(CheckoutErrorKind.CHECKOUT_IN_PROGRESS,
                "A checkout with idempotency key " + idempotencyKey + " is still in progress",
                TraceIdUtil.getTraceId());
    }

    private CheckoutResult finish(String idempotencyKey, String fingerprint, CheckoutResult result) {
        checkoutResultCache.put(idempotencyKey, fingerprint, result);
        return result;
    }

    private Order buildDraft(CheckoutRequest request, String fingerprint, String traceId) {
        BigDecimal loyaltyDiscount = zeroIfNull(request.getLoyaltyDiscountAmount());
        BigDecimal campaignDiscount = zeroIfNull(request.getCampaignDiscountAmount());
        int pointsToEarn = 0;
        if (StringUtils.hasText(request.getCustomerId())) {
            pointsToEarn = loyaltyLedgerService.calculatePointsToEarn(request.getVendorId(),
                    request.getSubtotal().subtract(loyaltyDiscount).subtract(campaignDiscount));
        }
        LocalDateTime now = LocalDateTime.now();
        return Order.builder()
                .id(UUID.randomUUID().toString())
                .orderNumber(generateOrderNumber())
                .idempotencyKey(request.getIdempotencyKey())
                .requestFingerprint(fingerprint)
                .vendorId(request.getVendorId())
                .locationId(request.getLocationId())
                .sessionId(request.getSessionId())
                .customerId(StringUtils.hasText(request.getCustomerId()) ? request.getCustomerId() : null)
                .status(OrderStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .paymentMethod(request.getPaymentMethod())
                .subtotal(request.getSubtotal())
                .taxAmount(request.getTaxAmount())
                .loyaltyDiscountAmount(loyaltyDiscount)
                .campaignDiscountAmount(campaignDiscount)
                .discountAmount(loyaltyDiscount.add(campaignDiscount))
                .total(request.getTotal())
                .loyaltyPointsRedeemed(request.pointsToRedeem())
                .loyaltyPointsEarned(pointsToEarn)
                .traceId(traceId)
                .createTime(now)
                .updateTime(now)
                .build();
    }

    private String fingerprint(CheckoutRequest request) throws JsonProcessingException {
        byte[] canonical = objectMapper.writeValueAsString(request).getBytes(StandardCharsets.UTF_8);
        return DigestUtils.md5DigestAsHex(canonical);
    }

    private void cancelQuietly(String orderId, String reason, CheckoutResult result,
                               List<PaymentTransaction> attempts) {
        try {
            orderLedgerService.cancel(orderId, reason, result, attempts);
        } catch (Exception e) {
            // reservations and holds still expire through the sweep
            log.error("[订单取消失败] orderId={}, reason={}, errorMsg={}, traceId={}",
                    orderId, reason, e.getMessage(), TraceIdUtil.getTraceId(), e);
        }
    }

    private void discardQuietly(String orderId) {
        try {
            orderLedgerService.discardDraft(orderId, REASON_ORDER_CREATION_FAILED);
        } catch (Exception e) {
            log.error("[草稿订单丢弃失败] orderId={}, errorMsg={}, traceId={}",
                    orderId, e.getMessage(), TraceIdUtil.getTraceId(), e);
        }
    }

    private void enqueueQuietly(String orderId, ReconciliationKind kind, ReconciliationPayload payload) {
        try {
            reconciliationQueueService.enqueue(orderId, kind, payload);
        } catch (Exception e) {
            log.error("[对账入队失败] orderId={}, kind={}, payload={}, errorMsg={}, traceId={}",
                    orderId, kind, payload, e.getMessage(), TraceIdUtil.getTraceId(), e);
        }
    }

    private boolean pause() {
        try {
            Thread.sleep(checkoutProperties.getReplayPollInterval().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static String generateOrderNumber() {
        StringBuilder suffix = new StringBuilder(6);
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < 6; i++) {
            suffix.append(ORDER_NUMBER_ALPHABET.charAt(random.nextInt(ORDER_NUMBER_ALPHABET.length())));
        }
        return "ORD-" + System.currentTimeMillis() + "-" + suffix;
    }

    private static BigDecimal zeroIfNull(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
