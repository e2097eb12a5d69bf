package com.pos.checkout.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pos.checkout.config.CheckoutProperties;
import com.pos.checkout.domain.ReconciliationKind;
import com.pos.checkout.domain.ReconciliationQueueItem;
import com.pos.checkout.dto.ReconciliationPayload;
import com.pos.checkout.event.ReconciliationEvent;
import com.pos.checkout.mapper.ReconciliationQueueMapper;
import com.pos.checkout.mq.ReconciliationEventPublisher;
import com.pos.checkout.service.IReconciliationQueueService;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 基于 reconciliation_queue_item 表的对账队列
 *
 * 1. 入队：先提交队列行，启用 MQ 时再发布事件
 * 2. 重试状态：retryCount / nextRetryAt 按指数退避，上限为 maxRetries
 * 3. 超过 maxRetries 的队列项保持未处理，等待人工处理
 */
@Slf4j
@Service
public class ReconciliationQueueServiceImpl extends ServiceImpl<ReconciliationQueueMapper, ReconciliationQueueItem>
        implements IReconciliationQueueService {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final ObjectMapper objectMapper;
    private final ReconciliationEventPublisher reconciliationEventPublisher;
    private final CheckoutProperties checkoutProperties;

    public ReconciliationQueueServiceImpl(ObjectMapper objectMapper,
                                          ReconciliationEventPublisher reconciliationEventPublisher,
                                          CheckoutProperties checkoutProperties) {
        this.objectMapper = objectMapper;
        this.reconciliationEventPublisher = reconciliationEventPublisher;
        this.checkoutProperties = checkoutProperties;
    }

    @Override
    public ReconciliationQueueItem enqueue(String orderId, ReconciliationKind kind, ReconciliationPayload payload) {
        String traceId = TraceIdUtil.getTraceId();
        LocalDateTime now = LocalDateTime.now();

        // ==================== 1. Persist ====================
        ReconciliationQueueItem item = ReconciliationQueueItem.builder()
                .orderId(orderId)
                .kind(kind)
                .payload(writePayload(payload))
                .resolved(false)
                .retryCount(0)
                .maxRetries(checkoutProperties.getReconciliation().getMaxRetries())
                .nextRetryAt(now.plus(checkoutProperties.getReconciliation().getInitialRetryDelay()))
                .lastError(truncate(payload == null ? null : payload.getErrorMessage()))
                .traceId(traceId)
                .createTime(now)
                .updateTime(now)
                .build();
        save(item);
        log.warn("[对账已入队] itemId={}, orderId={}, kind={}, traceId={}",
                item.getId(), orderId, kind, traceId);

        // ==================== 2. Notify ====================
        reconciliationEventPublisher.publish(ReconciliationEvent.builder()
                .itemId(item.getId())
                .orderId(orderId)
                .kind(kind)
                .traceId(traceId)
                .build());
        return item;
    }

    @Override
    public List<ReconciliationQueueItem> listUnresolved(ReconciliationKind kind) {
        return lambdaQuery()
                .eq(ReconciliationQueueItem::getResolved, false)
                .eq(kind != null, ReconciliationQueueItem::getKind, kind)
                .orderByAsc(ReconciliationQueueItem::getCreateTime)
                .list();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public boolean resolve(Long id, String resolutionNotes) {
        LocalDateTime now = LocalDateTime.now();
        boolean updated = lambdaUpdate()
                .set(ReconciliationQueueItem::getResolved, true)
                .set(ReconciliationQueueItem::getResolvedAt, now)
                .set(ReconciliationQueueItem::getResolutionNotes, truncate(resolutionNotes))
                .set(ReconciliationQueueItem::getUpdateTime, now)
                .eq(ReconciliationQueueItem::getId, id)
                .eq(ReconciliationQueueItem::getResolved, false)
                .update();
        if (updated) {
            log.info("[对账已处理] itemId={}, notes={}, traceId={}", id, resolutionNotes,
                    TraceIdUtil.getTraceId());
        }
        return updated;
    }

    @Override
    public List<ReconciliationQueueItem> listDueForRetry() {
        return lambdaQuery()
                .eq(ReconciliationQueueItem::getResolved, false)
                .le(ReconciliationQueueItem::getNextRetryAt, LocalDateTime.now())
                .apply("retry_count < max_retries")
                .orderByAsc(ReconciliationQueueItem::getNextRetryAt)
                .last("LIMIT " + checkoutProperties.getReconciliation().getBatchSize())
                .list();
    }

    @Override
    @Transactional(rollbackFor = Exception.class)
    public void markRetryFailed(Long id, String errorMessage) {
        ReconciliationQueueItem item = getById(id);
        if (item == null || Boolean.TRUE.equals(item.getResolved())) {
            return;
        }
        int retryCount = item.getRetryCount() + 1;
        item.setRetryCount(retryCount);
        item.setLastError(truncate(errorMessage));
        item.setUpdateTime(LocalDateTime.now());

        if (retryCount >= item.getMaxRetries()) {
            log.error("[对账重试次数耗尽] itemId={}, orderId={}, kind={}, retryCount={}, errorMsg={}",
                    id, item.getOrderId(), item.getKind(), retryCount, errorMessage);
        } else {
            long delaySeconds = checkoutProperties.getReconciliation().getInitialRetryDelay().getSeconds()
                    * (long) Math.pow(2, retryCount);
            item.setNextRetryAt(LocalDateTime.now().plusSeconds(delaySeconds));
            log.warn("[对账重试已安排] itemId={}, kind={}, inSeconds={}, retryCount={}/{}",
                    id, item.getKind(), delaySeconds, retryCount, item.getMaxRetries());
        }
        updateById(item);
    }

    @Override
    public boolean hasUnresolved(String orderId, ReconciliationKind kind) {
        return lambdaQuery()
                .eq(ReconciliationQueueItem::getOrderId, orderId)
                .eq(ReconciliationQueueItem::getKind, kind)
                .eq(ReconciliationQueueItem::getResolved, false)
                .count() > 0;
    }

    @Override
    public ReconciliationPayload readPayload(ReconciliationQueueItem item) {
        if (item.getPayload() == null) {
            return new ReconciliationPayload();
        }
        try {
            return objectMapper.readValue(item.getPayload(), ReconciliationPayload.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable reconciliation payload, itemId=" + item.getId(), e);
        }
    }

    private String writePayload(ReconciliationPayload payload) {
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize reconciliation payload", e);
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH);
    }
}
