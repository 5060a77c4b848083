package com.example.taskbroker.connection;

import java.io.IOException;

import org.springframework.amqp.core.Queue;

import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * 从 ConnectionHolder 借出的 Channel
 *
 * 使用完毕必须调用 {@link #release()}（或 try-with-resources），
 * release 把资源归还给 Holder，只生效一次
 */
public interface BrokerChannel extends AutoCloseable {

    void queueDeclare(Queue queue) throws IOException;

    /**
     * 被动声明队列并返回其中的消息数，队列不存在时抛出 404
     */
    long messageCount(String queueName) throws IOException;

    long queuePurge(String queueName) throws IOException;

    void queueDelete(String queueName, boolean ifUnused, boolean ifEmpty) throws IOException;

    void basicQos(int prefetchCount) throws IOException;

    /**
     * 以手动确认模式订阅队列，返回 consumerTag
     */
    String basicConsume(String queueName, DeliverCallback deliverCallback,
                        CancelCallback cancelCallback) throws IOException;

    void basicCancel(String consumerTag) throws IOException;

    void basicAck(long deliveryTag) throws IOException;

    void basicReject(long deliveryTag, boolean requeue) throws IOException;

    boolean isOpen();

    /**
     * Channel 关闭的原因，未关闭时为 null
     */
    ShutdownSignalException getCloseReason();

    int getChannelNumber();

    void release();

    @Override
    default void close() {
        release();
    }
}
