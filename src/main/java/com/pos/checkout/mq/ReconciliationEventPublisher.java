package com.pos.checkout.mq;

import com.pos.checkout.config.RabbitMQConfig;
import com.pos.checkout.event.ReconciliationEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 对账事件发布者
 * - 在队列行写入后发送，消息丢失只会把修复推迟到重试任务执行
 * - 仅在 checkout.reconciliation.mq.enabled=true 时发送
 */
@Slf4j
@Component
public class ReconciliationEventPublisher {

    private final RabbitTemplate rabbitTemplate;

    public ReconciliationEventPublisher(@Autowired(required = false) RabbitTemplate rabbitTemplate,
                                        @Value("${checkout.reconciliation.mq.enabled:false}") boolean mqEnabled) {
        this.rabbitTemplate = mqEnabled ? rabbitTemplate : null;
    }

    public void publish(ReconciliationEvent event) {
        String messageId = UUID.randomUUID().toString();
        event.setMessageId(messageId);
        event.setTimestamp(System.currentTimeMillis());

        if (rabbitTemplate == null) {
            log.debug("[RabbitMQ未启用] reconciliation item left for the retry task, itemId={}", event.getItemId());
            return;
        }
        try {
            rabbitTemplate.convertAndSend(
                    RabbitMQConfig.RECONCILIATION_EXCHANGE,
                    RabbitMQConfig.RECONCILIATION_ROUTING_KEY,
                    event,
                    message -> {
                        message.getMessageProperties().setHeader("messageId", messageId);
                        return message;
                    });
            log.info("[对账消息已发送] messageId={}, itemId={}, kind={}, traceId={}",
                    messageId, event.getItemId(), event.getKind(), event.getTraceId());
        } catch (Exception e) {
            log.error("[对账消息发送失败] itemId={}, errorMsg={}",
                    event.getItemId(), e.getMessage(), e);
        }
    }
}
