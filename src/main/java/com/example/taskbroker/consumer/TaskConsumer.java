package com.example.taskbroker.consumer;

import java.io.IOException;
import java.time.Duration;
import java.util.Collection;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import com.example.taskbroker.codec.MessageCodec;
import com.example.taskbroker.connection.BrokerChannel;
import com.example.taskbroker.exception.BrokerConnectionException;
import com.example.taskbroker.exception.MessageDecodeException;
import com.example.taskbroker.exception.TaskBrokerException;
import com.example.taskbroker.model.TaskMessage;
import com.rabbitmq.client.Delivery;

import lombok.Getter;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

/**
 * 任务消费者
 *
 * 绑定一个借出的 Channel，只能由创建它的线程（owner）拉取消息。
 * Channel 非线程安全时，其他线程的 ack / nack 会先放入队列，
 * 由 owner 线程在下一次 {@link #next()} 之前按提交顺序执行
 */
@Slf4j
public class TaskConsumer implements AutoCloseable {

    @Getter
    private final String queueName;

    private final BrokerChannel channel;
    private final QueueReader reader;
    private final MessageCodec codec;
    private final Duration readTimeout;
    private final boolean channelThreadSafe;
    private final boolean blockingAcknowledge;
    private final Duration acknowledgeTimeout;
    private final Thread ownerThread;

    private final Queue<DeferredAction> pendingAcks = new ConcurrentLinkedQueue<>();
    private final Queue<DeferredAction> pendingNacks = new ConcurrentLinkedQueue<>();

    public TaskConsumer(BrokerChannel channel, String queueName, int prefetch, Duration readTimeout,
                        MessageCodec codec, boolean channelThreadSafe,
                        boolean blockingAcknowledge, Duration acknowledgeTimeout) {
        if (!channel.isOpen()) {
            throw new BrokerConnectionException("Channel 已关闭，无法创建消费者: " + queueName);
        }
        this.channel = channel;
        this.queueName = queueName;
        this.reader = new QueueReader(channel, queueName, prefetch);
        this.codec = codec;
        this.readTimeout = readTimeout;
        this.channelThreadSafe = channelThreadSafe;
        this.blockingAcknowledge = blockingAcknowledge;
        this.acknowledgeTimeout = acknowledgeTimeout;
        this.ownerThread = Thread.currentThread();
    }

    /**
     * 确认队列存在
     *
     * @throws com.example.taskbroker.exception.QueueNotFoundException 队列不存在
     */
    public void check() {
        reader.check();
    }

    /**
     * 拉取下一条消息，readTimeout 内没有消息或消息无法解码时返回 null
     *
     * @throws BrokerConnectionException 连接或 Channel 不可用
     */
    public MessageProxy next() {
        drain(pendingAcks, true);
        drain(pendingNacks, false);

        Delivery delivery = reader.pop(readTimeout);
        if (delivery == null) {
            return null;
        }

        long deliveryTag = delivery.getEnvelope().getDeliveryTag();
        TaskMessage message;
        try {
            message = codec.decode(delivery.getBody());
        } catch (MessageDecodeException e) {
            log.error("✗ [Consumer] 消息解码失败，转入死信队列: queue={}, deliveryTag={}", queueName, deliveryTag, e);
            rejectUndecodable(deliveryTag);
            return null;
        }
        return new MessageProxy(message, channel, deliveryTag, delivery.getEnvelope().isRedeliver());
    }

    public void ack(MessageProxy message) {
        ack(message, blockingAcknowledge, acknowledgeTimeout);
    }

    /**
     * @param block   是否等待 ack 完成
     * @param timeout 等待 owner 线程执行的最长时间，null 表示一直等待
     */
    public void ack(MessageProxy message, boolean block, Duration timeout) {
        if (block && isThreadSafe()) {
            ackLogError(message);
            return;
        }
        submit(pendingAcks, message, block, timeout);
    }

    public void nack(MessageProxy message) {
        nack(message, blockingAcknowledge, acknowledgeTimeout);
    }

    public void nack(MessageProxy message, boolean block, Duration timeout) {
        if (block && isThreadSafe()) {
            nackLogError(message);
            return;
        }
        submit(pendingNacks, message, block, timeout);
    }

    /**
     * 未确认的消息在 Channel 关闭后由 Broker 重新投递，这里无需处理
     */
    public void requeue(Collection<MessageProxy> messages) {
        log.debug("[Consumer] {} 条消息将在 Channel 关闭后重新投递", messages.size());
    }

    @Override
    public void close() {
        try {
            if (reader.isConsuming()) {
                reader.cancel();
            }
        } catch (TaskBrokerException e) {
            log.warn("⚠ [Consumer] 取消订阅 {} 失败: {}", queueName, e.getMessage(), e);
        } finally {
            channel.release();
        }
    }

    private boolean isThreadSafe() {
        return channelThreadSafe || Thread.currentThread() == ownerThread;
    }

    private void submit(Queue<DeferredAction> actions, MessageProxy message, boolean block, Duration timeout) {
        if (!block) {
            actions.add(new DeferredAction(message, null));
            return;
        }
        CountDownLatch done = new CountDownLatch(1);
        actions.add(new DeferredAction(message, done));
        try {
            if (timeout == null) {
                done.await();
            } else if (!done.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("⚠ [Consumer] 等待 owner 线程确认消息超时: {}", message);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠ [Consumer] 等待确认消息时线程被中断: {}", message);
        }
    }

    private void drain(Queue<DeferredAction> actions, boolean ack) {
        DeferredAction action;
        while ((action = actions.poll()) != null) {
            try {
                if (ack) {
                    ackLogError(action.getMessage());
                } else {
                    nackLogError(action.getMessage());
                }
            } finally {
                if (action.getDone() != null) {
                    action.getDone().countDown();
                }
            }
        }
    }

    private void ackLogError(MessageProxy message) {
        try {
            message.ack();
        } catch (TaskBrokerException e) {
            log.warn("⚠ [Consumer] ack 失败: {}", message, e);
        }
    }

    private void nackLogError(MessageProxy message) {
        try {
            message.nack();
        } catch (TaskBrokerException e) {
            log.warn("⚠ [Consumer] nack 失败: {}", message, e);
        }
    }

    private void rejectUndecodable(long deliveryTag) {
        try {
            channel.basicReject(deliveryTag, false);
        } catch (IOException | RuntimeException e) {
            log.error("✗ [Consumer] 拒绝无法解码的消息失败: deliveryTag={}", deliveryTag, e);
        }
    }

    @Value
    private static class DeferredAction {
        MessageProxy message;
        CountDownLatch done;
    }
}
