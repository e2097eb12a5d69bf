package com.pos.checkout.domain;

import com.baomidou.mybatisplus.annotation.TableName;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 对账队列项
 * - 记录不能让结账失败的支付后故障
 * - 由修复任务按指数退避重试
 * - 人工处理或修复成功后标记为已处理
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@TableName("reconciliation_queue_item")
public class ReconciliationQueueItem {
    /**
     * Primary key
     */
    private Long id;

    /**
     * Order the failure belongs to
     */
    private String orderId;

    /**
     * Failed subsystem
     */
    private ReconciliationKind kind;

    /**
     * JSON payload needed to retry (ReconciliationPayload)
     */
    private String payload;

    private Boolean resolved;

    /**
     * Automated repair attempts so far
     */
    private Integer retryCount;

    private Integer maxRetries;

    /**
     * Earliest time the retry task may pick this item up again
     */
    private LocalDateTime nextRetryAt;

    private String lastError;

    private String resolutionNotes;

    private String traceId;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;

    private LocalDateTime resolvedAt;
}
