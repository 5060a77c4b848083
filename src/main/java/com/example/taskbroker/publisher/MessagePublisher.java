package com.example.taskbroker.publisher;

import java.time.Duration;
import java.util.Date;

import com.example.taskbroker.broker.BrokerOptions;
import com.example.taskbroker.codec.MessageCodec;
import com.example.taskbroker.connection.BrokerProducer;
import com.example.taskbroker.connection.ConnectionHolder;
import com.example.taskbroker.constant.BrokerConstants.DefaultConfig;
import com.example.taskbroker.constant.BrokerConstants.MessageOption;
import com.example.taskbroker.model.TaskMessage;
import com.rabbitmq.client.AMQP;

import lombok.extern.slf4j.Slf4j;

/**
 * 消息发布者
 *
 * 每次发布借出一个生产者，以 mandatory + Publisher Confirm 方式投递到默认交换机，
 * 路由键即队列名。连接类错误按 maxEnqueueAttempts 重试；
 * 消息无法路由时抛出 NoRouteException，由调用方决定如何处理
 */
@Slf4j
public class MessagePublisher {

    private static final String DEFAULT_EXCHANGE = "";

    private final ConnectionHolder connectionHolder;
    private final MessageCodec codec;
    private final BrokerOptions options;

    public MessagePublisher(ConnectionHolder connectionHolder, MessageCodec codec, BrokerOptions options) {
        this.connectionHolder = connectionHolder;
        this.codec = codec;
        this.options = options;
    }

    /**
     * 发布消息
     *
     * @param queueName 目标队列
     * @param message   消息
     * @param delay     延迟毫秒数，作为消息的 expiration；为空表示不过期
     */
    public void publish(String queueName, TaskMessage message, Long delay) {
        AMQP.BasicProperties properties = buildProperties(message, delay);
        byte[] body = codec.encode(message);

        connectionHolder.retryOverTime(() -> {
            try (BrokerProducer producer = connectionHolder.acquireProducer(true, options.getMaxProducerAcquireTimeout())) {
                producer.publish(DEFAULT_EXCHANGE, queueName, properties, body,
                        true, options.isConfirmDelivery(), options.getConfirmTimeout());
            }
            return null;
        }, options.enqueueRetrySettings(), this::onPublishError);

        log.debug("✓ [Publisher] 消息发送成功！消息ID: {}, 队列: {}", message.getMessageId(), queueName);
    }

    AMQP.BasicProperties buildProperties(TaskMessage message, Long delay) {
        return new AMQP.BasicProperties.Builder()
                .contentType(codec.getContentType())
                .contentEncoding("utf-8")
                .deliveryMode(DefaultConfig.PERSISTENT_DELIVERY_MODE)
                .priority(brokerPriority(message))
                .messageId(message.getMessageId())
                .timestamp(new Date(message.getMessageTimestamp()))
                .expiration(delay == null ? null : String.valueOf(delay))
                .build();
    }

    private static Integer brokerPriority(TaskMessage message) {
        Object priority = message.getOption(MessageOption.BROKER_PRIORITY);
        return priority instanceof Number ? ((Number) priority).intValue() : null;
    }

    private void onPublishError(Throwable error, Duration sleep) {
        log.warn("⟳ [Publisher] 消息发送失败，{} 秒后重试: {}", sleep.toMillis() / 1000.0, error.toString(), error);
    }
}
