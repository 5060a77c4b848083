package com.example.taskbroker.connection;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import com.example.taskbroker.exception.NoRouteException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Return;
import com.rabbitmq.client.ReturnListener;

/**
 * 绑定到一个 Channel 的发布者，只属于一次发布调用
 *
 * mandatory 消息无法路由时 Broker 先发送 basic.return 再发送 ack，
 * 所以等到 confirm 之后检查是否被退回即可
 */
public class BrokerProducer implements AutoCloseable {

    private final ReleasableChannel channel;

    public BrokerProducer(ReleasableChannel channel) {
        this.channel = channel;
    }

    /**
     * 发布一条消息
     *
     * @param confirm        是否开启 Publisher Confirms 并等待确认
     * @param confirmTimeout 等待确认的最长时间
     * @throws NoRouteException mandatory 消息被退回
     * @throws TimeoutException 等待确认超时
     */
    public void publish(String exchange, String routingKey, AMQP.BasicProperties properties, byte[] body,
                        boolean mandatory, boolean confirm, Duration confirmTimeout)
            throws IOException, InterruptedException, TimeoutException {
        Channel target = channel.getDelegate();
        if (confirm && target.getNextPublishSeqNo() == 0) {
            target.confirmSelect();
        }

        AtomicReference<Return> returned = new AtomicReference<>();
        ReturnListener listener = mandatory ? target.addReturnListener(returned::set) : null;
        try {
            target.basicPublish(exchange, routingKey, mandatory, properties, body);
            if (confirm) {
                if (confirmTimeout == null) {
                    target.waitForConfirmsOrDie();
                } else {
                    target.waitForConfirmsOrDie(confirmTimeout.toMillis());
                }
            }
        } finally {
            if (listener != null) {
                target.removeReturnListener(listener);
            }
        }

        Return returnedMessage = returned.get();
        if (returnedMessage != null) {
            throw new NoRouteException(returnedMessage.getReplyText(),
                    returnedMessage.getExchange(), returnedMessage.getRoutingKey());
        }
    }

    public BrokerChannel getChannel() {
        return channel;
    }

    public void release() {
        channel.release();
    }

    @Override
    public void close() {
        release();
    }
}
