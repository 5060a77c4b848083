package com.example.taskbroker.consumer;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.example.taskbroker.connection.BrokerChannel;
import com.example.taskbroker.connection.TransportErrors;
import com.example.taskbroker.exception.BrokerConnectionException;
import com.example.taskbroker.exception.TaskBrokerException;
import com.rabbitmq.client.Delivery;
import com.rabbitmq.client.ShutdownSignalException;

import lombok.extern.slf4j.Slf4j;

/**
 * 拉取式读取队列
 *
 * 第一次 pop 时订阅队列，投递的消息放入本地缓冲区；出错后取消订阅，下一次 pop 重新订阅
 */
@Slf4j
public class QueueReader {

    private final BrokerChannel channel;
    private final String queueName;
    private final int prefetchCount;
    private final BlockingQueue<Delivery> buffer = new LinkedBlockingQueue<>();

    private volatile boolean consuming;
    private volatile String consumerTag;

    public QueueReader(BrokerChannel channel, String queueName, int prefetchCount) {
        this.channel = channel;
        this.queueName = queueName;
        this.prefetchCount = prefetchCount;
    }

    /**
     * 检查队列是否存在：订阅后立即取消
     *
     * @throws IllegalStateException 已经在订阅中
     * @throws com.example.taskbroker.exception.QueueNotFoundException 队列不存在
     */
    public void check() {
        if (consuming) {
            throw new IllegalStateException("check() 必须在 pop() 之前调用");
        }
        try {
            startConsuming();
        } finally {
            cancelQuietly();
        }
    }

    /**
     * 取出一条消息，超时或没有消息时返回 null
     *
     * @throws BrokerConnectionException 订阅失败、Channel 已关闭或线程被中断（中断标记会保留）
     */
    public Delivery pop(Duration timeout) {
        try {
            startConsuming();
            Delivery delivery = buffer.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (delivery == null && !channel.isOpen()) {
                ShutdownSignalException reason = channel.getCloseReason();
                throw reason != null
                        ? TransportErrors.toLibraryError(reason)
                        : new BrokerConnectionException("Channel 已关闭: " + queueName);
            }
            return delivery;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectionException("读取队列 " + queueName + " 时线程被中断", e);
        } catch (RuntimeException e) {
            cancelQuietly();
            throw e;
        }
    }

    public boolean isConsuming() {
        return consuming;
    }

    /**
     * 取消订阅；已缓冲但未确认的消息在 Channel 关闭后由 Broker 重新投递
     */
    public void cancel() {
        String tag = consumerTag;
        consuming = false;
        consumerTag = null;
        if (tag == null) {
            return;
        }
        try {
            channel.basicCancel(tag);
        } catch (IOException | RuntimeException e) {
            throw TransportErrors.toLibraryError(e);
        }
    }

    private void startConsuming() {
        if (consuming) {
            return;
        }
        try {
            channel.basicQos(prefetchCount);
            consumerTag = channel.basicConsume(queueName,
                    (tag, delivery) -> buffer.offer(delivery),
                    this::onCancelled);
            consuming = true;
        } catch (IOException | RuntimeException e) {
            throw TransportErrors.toLibraryError(e);
        }
    }

    private void cancelQuietly() {
        try {
            cancel();
        } catch (TaskBrokerException e) {
            log.warn("⚠ [QueueReader] 取消订阅 {} 失败: {}", queueName, e.getMessage(), e);
        }
    }

    /**
     * Broker 主动取消订阅（例如队列被删除），下一次 pop 重新订阅
     */
    private void onCancelled(String tag) {
        log.warn("⚠ [QueueReader] 队列 {} 的订阅被 Broker 取消: consumerTag={}", queueName, tag);
        consuming = false;
        consumerTag = null;
    }
}
