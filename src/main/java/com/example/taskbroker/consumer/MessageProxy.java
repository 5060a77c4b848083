package com.example.taskbroker.consumer;

import java.io.IOException;

import com.example.taskbroker.connection.BrokerChannel;
import com.example.taskbroker.connection.TransportErrors;
import com.example.taskbroker.model.TaskMessage;

import lombok.Getter;

/**
 * 一次投递的句柄：解码后的消息 + 确认状态
 *
 * ack / nack 只生效一次，重复调用返回最终状态是否与本次请求一致
 */
public class MessageProxy {

    private enum AckState {
        PENDING, ACKED, REJECTED
    }

    @Getter
    private final TaskMessage message;

    @Getter
    private final long deliveryTag;

    @Getter
    private final boolean redelivered;

    private final BrokerChannel channel;

    private AckState state = AckState.PENDING;

    /** 最近一次 ack / nack 失败的异常 */
    @Getter
    private volatile Exception lastAcknowledgeError;

    public MessageProxy(TaskMessage message, BrokerChannel channel, long deliveryTag, boolean redelivered) {
        this.message = message;
        this.channel = channel;
        this.deliveryTag = deliveryTag;
        this.redelivered = redelivered;
    }

    public String getMessageId() {
        return message.getMessageId();
    }

    public String getQueueName() {
        return message.getQueueName();
    }

    public synchronized boolean isAcknowledged() {
        return state != AckState.PENDING;
    }

    /**
     * 确认消息
     *
     * @return 消息是否处于已确认状态
     */
    public synchronized boolean ack() {
        if (state != AckState.PENDING) {
            return state == AckState.ACKED;
        }
        try {
            channel.basicAck(deliveryTag);
        } catch (IOException | RuntimeException e) {
            lastAcknowledgeError = e;
            throw TransportErrors.toLibraryError(e);
        }
        state = AckState.ACKED;
        return true;
    }

    /**
     * 拒绝消息
     *
     * @param requeue false 时消息进入死信队列
     * @return 消息是否处于已拒绝状态
     */
    public synchronized boolean nack(boolean requeue) {
        if (state != AckState.PENDING) {
            return state == AckState.REJECTED;
        }
        try {
            channel.basicReject(deliveryTag, requeue);
        } catch (IOException | RuntimeException e) {
            lastAcknowledgeError = e;
            throw TransportErrors.toLibraryError(e);
        }
        state = AckState.REJECTED;
        return true;
    }

    public boolean nack() {
        return nack(false);
    }

    @Override
    public String toString() {
        return "MessageProxy{messageId=" + getMessageId() + ", queue=" + getQueueName()
                + ", deliveryTag=" + deliveryTag + "}";
    }
}
