package com.pos.checkout.mq;

import com.pos.checkout.business.ReconciliationRepairService;
import com.pos.checkout.config.RabbitMQConfig;
import com.pos.checkout.event.ReconciliationEvent;
import com.pos.checkout.util.TraceIdUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.annotation.RabbitHandler;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 对账事件消费者
 * - 队列项入队后立即尝试修复
 * - 修复失败已记录在队列项上（重试次数、下次重试时间）；消息进入死信队列，
 *   由重试任务接手
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "checkout.reconciliation.mq.enabled", havingValue = "true")
public class ReconciliationEventConsumer {

    private final ReconciliationRepairService reconciliationRepairService;

    public ReconciliationEventConsumer(ReconciliationRepairService reconciliationRepairService) {
        this.reconciliationRepairService = reconciliationRepairService;
    }

    @RabbitListener(queues = RabbitMQConfig.RECONCILIATION_QUEUE)
    @RabbitHandler
    public void consumeReconciliationEvent(ReconciliationEvent event) {
        TraceIdUtil.setTraceId(event.getTraceId());
        log.info("[收到对账消息] messageId={}, itemId={}, orderId={}, kind={}, traceId={}",
                event.getMessageId(), event.getItemId(), event.getOrderId(), event.getKind(), event.getTraceId());
        try {
            String notes = reconciliationRepairService.repairById(event.getItemId());
            log.info("[对账消息已处理] messageId={}, itemId={}, notes={}",
                    event.getMessageId(), event.getItemId(), notes);
        } catch (Exception e) {
            log.error("[对账消息处理失败] messageId={}, itemId={}, errorMsg={}, traceId={}",
                    event.getMessageId(), event.getItemId(), e.getMessage(), event.getTraceId(), e);
            throw new IllegalStateException("Reconciliation repair failed for item " + event.getItemId(), e);
        } finally {
            TraceIdUtil.clearTraceId();
        }
    }
}
