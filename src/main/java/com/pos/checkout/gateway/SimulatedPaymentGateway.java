package com.pos.checkout.gateway;

import com.pos.checkout.exception.PaymentGatewayException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 未接入真实处理方时使用的进程内网关（checkout.payment.gateway=simulated）
 * - 每个幂等键只保留一个结果，重试不会重复扣款
 * - 运行时可切换行为，用于模拟拒绝、处理异常和挂起
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "checkout.payment.gateway", havingValue = "simulated", matchIfMissing = true)
public class SimulatedPaymentGateway implements PaymentGateway {

    public enum Mode {
        APPROVE,
        DECLINE,
        ERROR,
        /** Sleeps past the caller's timeout, then approves. */
        HANG
    }

    private final Map<String, ChargeResult> resultsByKey = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> invocationsByKey = new ConcurrentHashMap<>();
    private final Set<String> voidedReferences = ConcurrentHashMap.newKeySet();
    private final Set<String> erroredKeys = ConcurrentHashMap.newKeySet();

    private final double declineRate;
    private volatile Mode mode = Mode.APPROVE;
    private volatile long hangMillis = 5000;

    public SimulatedPaymentGateway(@Value("${checkout.payment.simulated.decline-rate:0.0}") double declineRate) {
        this.declineRate = declineRate;
    }

    @Override
    public ChargeResult charge(ChargeRequest request) {
        String key = request.getIdempotencyKey();
        invocationsByKey.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();

        ChargeResult previous = resultsByKey.get(key);
        if (previous != null) {
            log.info("[网关重放] idempotencyKey={}, outcome={}", key, previous.getOutcome());
            return previous;
        }

        switch (mode) {
            case DECLINE:
                return resultsByKey.computeIfAbsent(key, k -> ChargeResult.declined("Card declined"));
            case ERROR:
                // processor errors are not stored as results; the key may be charged again
                erroredKeys.add(key);
                return ChargeResult.error("Processor error");
            case HANG:
                sleep(hangMillis);
                return resultsByKey.computeIfAbsent(key, k -> approve(request));
            default:
                if (declineRate > 0 && ThreadLocalRandom.current().nextDouble() < declineRate) {
                    return resultsByKey.computeIfAbsent(key, k -> ChargeResult.declined("Card declined"));
                }
                return resultsByKey.computeIfAbsent(key, k -> approve(request));
        }
    }

    @Override
    public ChargeResult lookup(String idempotencyKey) {
        ChargeResult result = resultsByKey.get(idempotencyKey);
        if (result != null) {
            return result;
        }
        if (erroredKeys.contains(idempotencyKey)) {
            return ChargeResult.error("Last attempt failed at the processor, nothing captured");
        }
        return ChargeResult.unknown("No charge recorded for key");
    }

    @Override
    public boolean voidCharge(String referenceId) {
        boolean known = resultsByKey.values().stream()
                .anyMatch(r -> referenceId.equals(r.getReferenceId()));
        if (!known) {
            throw new PaymentGatewayException("Unknown charge reference " + referenceId);
        }
        voidedReferences.add(referenceId);
        log.info("[网关撤销扣款] referenceId={}", referenceId);
        return true;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public void setHangMillis(long hangMillis) {
        this.hangMillis = hangMillis;
    }

    public int invocationCount(String idempotencyKey) {
        AtomicInteger count = invocationsByKey.get(idempotencyKey);
        return count == null ? 0 : count.get();
    }

    public boolean isVoided(String referenceId) {
        return voidedReferences.contains(referenceId);
    }

    public void reset() {
        resultsByKey.clear();
        invocationsByKey.clear();
        voidedReferences.clear();
        erroredKeys.clear();
        mode = Mode.APPROVE;
        hangMillis = 5000;
    }

    private ChargeResult approve(ChargeRequest request) {
        String referenceId = "SIM-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
        String authCode = String.valueOf(ThreadLocalRandom.current().nextInt(100000, 999999));
        log.info("[网关扣款成功] idempotencyKey={}, amount={}, referenceId={}",
                request.getIdempotencyKey(), request.getAmount(), referenceId);
        return ChargeResult.approved(referenceId, authCode, request.getAmount());
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
