package com.pos.checkout.event;

import com.pos.checkout.domain.ReconciliationKind;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 对账事件
 * 队列项持久化后发布，消费者可以立即尝试修复。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReconciliationEvent {
    /**
     * Message ID
     */
    private String messageId;

    /**
     * ReconciliationQueueItem id
     */
    private Long itemId;

    private String orderId;

    private ReconciliationKind kind;

    private String traceId;

    /**
     * Event timestamp (epoch millis)
     */
    private Long timestamp;
}
