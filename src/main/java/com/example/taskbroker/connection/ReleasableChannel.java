package com.example.taskbroker.connection;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.springframework.amqp.core.Queue;

import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DeliverCallback;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * BrokerChannel 的默认实现：包装一个 Channel 和它的归还动作
 */
public class ReleasableChannel implements BrokerChannel {

    private final Channel delegate;
    private final Runnable releaseAction;
    private final AtomicBoolean released = new AtomicBoolean(false);

    public ReleasableChannel(Channel delegate, Runnable releaseAction) {
        this.delegate = delegate;
        this.releaseAction = releaseAction;
    }

    Channel getDelegate() {
        ensureNotReleased();
        return delegate;
    }

    @Override
    public void queueDeclare(Queue queue) throws IOException {
        getDelegate().queueDeclare(queue.getName(), queue.isDurable(), queue.isExclusive(),
                queue.isAutoDelete(), queue.getArguments());
    }

    @Override
    public long messageCount(String queueName) throws IOException {
        return getDelegate().queueDeclarePassive(queueName).getMessageCount();
    }

    @Override
    public long queuePurge(String queueName) throws IOException {
        return getDelegate().queuePurge(queueName).getMessageCount();
    }

    @Override
    public void queueDelete(String queueName, boolean ifUnused, boolean ifEmpty) throws IOException {
        getDelegate().queueDelete(queueName, ifUnused, ifEmpty);
    }

    @Override
    public void basicQos(int prefetchCount) throws IOException {
        getDelegate().basicQos(prefetchCount);
    }

    @Override
    public String basicConsume(String queueName, DeliverCallback deliverCallback,
                               CancelCallback cancelCallback) throws IOException {
        return getDelegate().basicConsume(queueName, false, deliverCallback, cancelCallback);
    }

    @Override
    public void basicCancel(String consumerTag) throws IOException {
        getDelegate().basicCancel(consumerTag);
    }

    @Override
    public void basicAck(long deliveryTag) throws IOException {
        getDelegate().basicAck(deliveryTag, false);
    }

    @Override
    public void basicReject(long deliveryTag, boolean requeue) throws IOException {
        getDelegate().basicReject(deliveryTag, requeue);
    }

    @Override
    public boolean isOpen() {
        return !released.get() && delegate.isOpen();
    }

    @Override
    public ShutdownSignalException getCloseReason() {
        return delegate.getCloseReason();
    }

    @Override
    public int getChannelNumber() {
        return delegate.getChannelNumber();
    }

    @Override
    public void release() {
        if (released.compareAndSet(false, true)) {
            releaseAction.run();
        }
    }

    private void ensureNotReleased() {
        if (released.get()) {
            throw new IllegalStateException("Channel 已归还，不能继续使用");
        }
    }
}
