package com.pos.checkout.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.DirectExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ 配置
 * - 对账交换机与队列，消费者拒绝的消息进入死信队列
 * - 仅在 checkout.reconciliation.mq.enabled=true 时生效，否则只由重试任务处理队列表
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "checkout.reconciliation.mq.enabled", havingValue = "true")
public class RabbitMQConfig {

    public static final String RECONCILIATION_EXCHANGE = "checkout.reconciliation.exchange";
    public static final String RECONCILIATION_QUEUE = "checkout.reconciliation.queue";
    public static final String RECONCILIATION_ROUTING_KEY = "checkout.reconciliation";

    public static final String RECONCILIATION_DLX_EXCHANGE = "checkout.reconciliation.dlx.exchange";
    public static final String RECONCILIATION_DLX_QUEUE = "checkout.reconciliation.dlx.queue";
    public static final String RECONCILIATION_DLX_ROUTING_KEY = "checkout.reconciliation.dlx";

    // ==================== Reconciliation queue ====================

    @Bean
    public DirectExchange reconciliationExchange() {
        return new DirectExchange(RECONCILIATION_EXCHANGE, true, false);
    }

    @Bean
    public Queue reconciliationQueue() {
        return QueueBuilder.durable(RECONCILIATION_QUEUE)
                .deadLetterExchange(RECONCILIATION_DLX_EXCHANGE)
                .deadLetterRoutingKey(RECONCILIATION_DLX_ROUTING_KEY)
                .build();
    }

    @Bean
    public Binding reconciliationBinding(Queue reconciliationQueue, DirectExchange reconciliationExchange) {
        return BindingBuilder.bind(reconciliationQueue)
                .to(reconciliationExchange)
                .with(RECONCILIATION_ROUTING_KEY);
    }

    // ==================== Dead-letter queue (left for operators) ====================

    @Bean
    public DirectExchange reconciliationDlxExchange() {
        return new DirectExchange(RECONCILIATION_DLX_EXCHANGE, true, false);
    }

    @Bean
    public Queue reconciliationDlxQueue() {
        return QueueBuilder.durable(RECONCILIATION_DLX_QUEUE).build();
    }

    @Bean
    public Binding reconciliationDlxBinding(Queue reconciliationDlxQueue, DirectExchange reconciliationDlxExchange) {
        return BindingBuilder.bind(reconciliationDlxQueue)
                .to(reconciliationDlxExchange)
                .with(RECONCILIATION_DLX_ROUTING_KEY);
    }

    // ==================== RabbitTemplate ====================

    @Bean
    public MessageConverter jsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory, MessageConverter jsonMessageConverter) {
        RabbitTemplate rabbitTemplate = new RabbitTemplate(connectionFactory);
        rabbitTemplate.setMessageConverter(jsonMessageConverter);
        rabbitTemplate.setConfirmCallback((correlationData, ack, cause) -> {
            if (!ack) {
                log.error("[对账消息未确认] cause={}", cause);
            }
        });
        return rabbitTemplate;
    }
}
