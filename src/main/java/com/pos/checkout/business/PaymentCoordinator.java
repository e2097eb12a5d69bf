package com.pos.checkout.business;

import com.pos.checkout.config.CheckoutProperties;
import com.pos.checkout.domain.Order;
import com.pos.checkout.domain.PaymentMethod;
import com.pos.checkout.domain.PaymentTransaction;
import com.pos.checkout.domain.PaymentTransactionStatus;
import com.pos.checkout.dto.CheckoutRequest;
import com.pos.checkout.gateway.ChargeRequest;
import com.pos.checkout.gateway.ChargeResult;
import com.pos.checkout.gateway.PaymentGateway;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 支付步骤（PROCESS_PAYMENT）
 * - 现金：本地直接通过，不调用外部系统
 * - 银行卡：以结账幂等键调用网关扣款
 * - 拆分支付：现金部分本地记录，网关只扣银行卡部分
 *
 * 在 checkout.payment-timeout 内未响应或返回处理异常的扣款，既不取消也不换键重发：按幂等键查询网关的真实结果。
 * 只有明确的拒绝才是最终结果。
 * 执行期间不持有任何数据库锁。
 */
@Slf4j
@Component
public class PaymentCoordinator {

    static final String CASH_AUTH_CODE = "CASH";

    private final PaymentGateway paymentGateway;
    private final ExecutorService paymentExecutor;
    private final CheckoutProperties checkoutProperties;

    public PaymentCoordinator(PaymentGateway paymentGateway,
                              @Qualifier("paymentExecutor") ExecutorService paymentExecutor,
                              CheckoutProperties checkoutProperties) {
        this.paymentGateway = paymentGateway;
        this.paymentExecutor = paymentExecutor;
        this.checkoutProperties = checkoutProperties;
    }

    public PaymentOutcome process(Order order, CheckoutRequest request) {
        BigDecimal total = order.getTotal();
        switch (order.getPaymentMethod()) {
            case CASH:
                return approved(List.of(cashTransaction(order, total)), total, BigDecimal.ZERO, null);
            case CARD:
                return chargeCard(order, BigDecimal.ZERO, total);
            case SPLIT:
                return chargeCard(order, request.getSplitPayment().getCashAmount(),
                        request.getSplitPayment().getCardAmount());
            default:
                throw new IllegalArgumentException("Unsupported payment method " + order.getPaymentMethod());
        }
    }

    private PaymentOutcome chargeCard(Order order, BigDecimal cashAmount, BigDecimal cardAmount) {
        String traceId = TraceIdUtil.getTraceId();
        List<PaymentTransaction> transactions = new ArrayList<>(2);
        if (cashAmount.signum() > 0) {
            transactions.add(cashTransaction(order, cashAmount));
        }
        if (cardAmount.signum() == 0) {
            return approved(transactions, cashAmount, cardAmount, null);
        }

        // ==================== 1. Charge, bounded by the payment timeout ====================
        ChargeRequest chargeRequest = ChargeRequest.builder()
                .amount(cardAmount)
                .method(PaymentMethod.CARD)
                .idempotencyKey(order.getIdempotencyKey())
                .metadata(metadata(order))
                .build();
        log.info("[网关扣款] orderId={}, amount={}, idempotencyKey={}, traceId={}",
                order.getId(), cardAmount, order.getIdempotencyKey(), traceId);

        ChargeResult result = callWithTimeout(chargeRequest);

        // ==================== 2. No answer or processor error: poll by key ====================
        if (!result.isSettled()) {
            ChargeResult polled = pollOutcome(order.getIdempotencyKey());
            if (polled.isSettled()) {
                result = polled;
            }
        }

        // ==================== 3. Resolve ====================
        switch (result.getOutcome()) {
            case APPROVED:
                transactions.add(cardTransaction(order, cardAmount, PaymentTransactionStatus.APPROVED, result, null));
                log.info("[网关扣款成功] orderId={}, referenceId={}, traceId={}",
                        order.getId(), result.getReferenceId(), traceId);
                return approved(transactions, cashAmount, cardAmount, result.getReferenceId());
            case DECLINED:
                log.warn("[网关拒绝扣款] orderId={}, reason={}, traceId={}",
                        order.getId(), result.getReason(), traceId);
                return PaymentOutcome.builder()
                        .status(PaymentOutcome.Status.DECLINED)
                        .transactions(List.of(cardTransaction(order, cardAmount, PaymentTransactionStatus.DECLINED,
                                result, result.getReason())))
                        .reason(result.getReason())
                        .cashAmount(cashAmount)
                        .cardAmount(cardAmount)
                        .build();
            default:
                // ERROR or UNKNOWN after polling; the key is handed to reconciliation
                log.error("[网关结果未知] orderId={}, idempotencyKey={}, outcome={}, reason={}, traceId={}",
                        order.getId(), order.getIdempotencyKey(), result.getOutcome(), result.getReason(), traceId);
                return PaymentOutcome.builder()
                        .status(PaymentOutcome.Status.UNKNOWN)
                        .transactions(List.of(cardTransaction(order, cardAmount, PaymentTransactionStatus.ERROR,
                                result, "Outcome unknown: " + result.getReason())))
                        .reason(result.getReason())
                        .cashAmount(cashAmount)
                        .cardAmount(cardAmount)
                        .build();
        }
    }

    private ChargeResult callWithTimeout(ChargeRequest chargeRequest) {
        Future<ChargeResult> future = paymentExecutor.submit(() -> paymentGateway.charge(chargeRequest));
        try {
            ChargeResult result = future.get(checkoutProperties.getPaymentTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : ChargeResult.unknown("Gateway returned no result");
        } catch (TimeoutException e) {
            // the call keeps running; its result is picked up by key
            log.warn("[网关超时] idempotencyKey={}, timeoutMs={}",
                    chargeRequest.getIdempotencyKey(), checkoutProperties.getPaymentTimeout().toMillis());
            return ChargeResult.unknown("Gateway did not answer within " + checkoutProperties.getPaymentTimeout());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[网关调用失败] idempotencyKey={}, errorMsg={}",
                    chargeRequest.getIdempotencyKey(), cause.getMessage());
            return ChargeResult.unknown(cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ChargeResult.unknown("Interrupted while waiting for the gateway");
        }
    }

    private ChargeResult pollOutcome(String idempotencyKey) {
        ChargeResult last = ChargeResult.unknown("No outcome after polling");
        for (int attempt = 1; attempt <= checkoutProperties.getPaymentPollAttempts(); attempt++) {
            try {
                Thread.sleep(checkoutProperties.getPaymentPollInterval().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return last;
            }
            try {
                ChargeResult looked = paymentGateway.lookup(idempotencyKey);
                log.info("[网关结果查询] idempotencyKey={}, attempt={}, outcome={}",
                        idempotencyKey, attempt, looked.getOutcome());
                if (looked.isSettled()) {
                    return looked;
                }
                last = looked;
            } catch (Exception e) {
                log.warn("[网关结果查询失败] idempotencyKey={}, attempt={}, errorMsg={}",
                        idempotencyKey, attempt, e.getMessage());
            }
        }
        return last;
    }

    private PaymentOutcome approved(List<PaymentTransaction> transactions, BigDecimal cashAmount,
                                    BigDecimal cardAmount, String cardReferenceId) {
        return PaymentOutcome.builder()
                .status(PaymentOutcome.Status.APPROVED)
                .transactions(transactions)
                .cashAmount(cashAmount)
                .cardAmount(cardAmount)
                .cardReferenceId(cardReferenceId)
                .build();
    }

    private PaymentTransaction cashTransaction(Order order, BigDecimal amount) {
        return PaymentTransaction.builder()
                .orderId(order.getId())
                .paymentMethod(PaymentMethod.CASH)
                .amount(amount)
                .status(PaymentTransactionStatus.APPROVED)
                .processorReferenceId("CASH-" + order.getOrderNumber())
                .authCode(CASH_AUTH_CODE)
                .idempotencyKey(order.getIdempotencyKey())
                .traceId(TraceIdUtil.getTraceId())
                .createTime(LocalDateTime.now())
                .build();
    }

    private PaymentTransaction cardTransaction(Order order, BigDecimal amount, PaymentTransactionStatus status,
                                               ChargeResult result, String errorMessage) {
        return PaymentTransaction.builder()
                .orderId(order.getId())
                .paymentMethod(PaymentMethod.CARD)
                .amount(amount)
                .status(status)
                .processorReferenceId(result.getReferenceId())
                .authCode(result.getAuthCode())
                .idempotencyKey(order.getIdempotencyKey())
                .errorMessage(errorMessage)
                .traceId(TraceIdUtil.getTraceId())
                .createTime(LocalDateTime.now())
                .build();
    }

    private Map<String, String> metadata(Order order) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("orderId", order.getId());
        metadata.put("orderNumber", order.getOrderNumber());
        metadata.put("vendorId", order.getVendorId());
        metadata.put("locationId", order.getLocationId());
        return metadata;
    }
}
