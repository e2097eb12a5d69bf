package com.pos.checkout.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.pos.checkout.domain.ReconciliationKind;
import com.pos.checkout.domain.ReconciliationQueueItem;
import com.pos.checkout.dto.ReconciliationPayload;

import java.util.List;

/**
 * 对账队列
 *
 * 支付后故障的追加式记录。同一故障允许重复入队；
 * 修复时检查订单真实状态，而不是统计行数。
 */
public interface IReconciliationQueueService extends IService<ReconciliationQueueItem> {

    ReconciliationQueueItem enqueue(String orderId, ReconciliationKind kind, ReconciliationPayload payload);

    /**
     * @param kind 为 null 时查询所有类型
     */
    List<ReconciliationQueueItem> listUnresolved(ReconciliationKind kind);

    /**
     * 幂等：处理已处理的队列项返回 false，不做修改。
     */
    boolean resolve(Long id, String resolutionNotes);

    /**
     * 已到重试时间且仍有重试次数的未处理队列项。
     */
    List<ReconciliationQueueItem> listDueForRetry();

    /**
     * 记录一次失败的修复，并按指数退避安排下次重试。
     */
    void markRetryFailed(Long id, String errorMessage);

    boolean hasUnresolved(String orderId, ReconciliationKind kind);

    ReconciliationPayload readPayload(ReconciliationQueueItem item);
}
