package com.example.taskbroker.connection;

import java.time.Duration;

import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory.CacheMode;
import org.springframework.amqp.rabbit.connection.Connection;

import com.rabbitmq.client.Channel;

import lombok.extern.slf4j.Slf4j;

/**
 * 共享连接策略：消费者、生产者各一条长连接，借出的是连接上的 Channel
 *
 * 每个角色一个 CHANNEL 模式的 CachingConnectionFactory；
 * "确认连接可用并创建 Channel" 在该角色的锁内原子完成
 */
@Slf4j
public class SharedConnectionHolder extends AbstractConnectionHolder {

    private final CachingConnectionFactory consumerConnectionFactory;
    private final CachingConnectionFactory producerConnectionFactory;
    private final AcquisitionLimiter consumerLimiter;
    private final AcquisitionLimiter producerLimiter;
    private final Object consumerLock = new Object();
    private final Object producerLock = new Object();

    public SharedConnectionHolder(com.rabbitmq.client.ConnectionFactory rabbitConnectionFactory, HolderOptions options) {
        super(options);
        this.consumerConnectionFactory = createShared(rabbitConnectionFactory,
                this.options.getConsumerChannelPoolSize(), "consumer");
        this.producerConnectionFactory = createShared(rabbitConnectionFactory,
                this.options.getProducerChannelPoolSize(), "producer");
        this.consumerLimiter = new AcquisitionLimiter("消费者 Channel 池", this.options.getConsumerChannelPoolSize());
        this.producerLimiter = new AcquisitionLimiter("生产者 Channel 池", this.options.getProducerChannelPoolSize());
    }

    SharedConnectionHolder(CachingConnectionFactory consumerConnectionFactory,
                           CachingConnectionFactory producerConnectionFactory,
                           HolderOptions options) {
        super(options);
        this.consumerConnectionFactory = consumerConnectionFactory;
        this.producerConnectionFactory = producerConnectionFactory;
        this.consumerLimiter = new AcquisitionLimiter("消费者 Channel 池", this.options.getConsumerChannelPoolSize());
        this.producerLimiter = new AcquisitionLimiter("生产者 Channel 池", this.options.getProducerChannelPoolSize());
    }

    private CachingConnectionFactory createShared(com.rabbitmq.client.ConnectionFactory rabbitConnectionFactory,
                                                  Integer channelPoolSize, String role) {
        CachingConnectionFactory factory = createConnectionFactory(rabbitConnectionFactory, CacheMode.CHANNEL, role);
        if (channelPoolSize != null) {
            factory.setChannelCacheSize(channelPoolSize);
        }
        return factory;
    }

    @Override
    public BrokerProducer acquireProducer(boolean block, Duration timeout) {
        return new BrokerProducer(acquire(producerConnectionFactory, producerLimiter, producerLock, block, timeout));
    }

    @Override
    public BrokerChannel acquireConsumerChannel(boolean block, Duration timeout) {
        return acquire(consumerConnectionFactory, consumerLimiter, consumerLock, block, timeout);
    }

    /**
     * 默认不阻塞：Channel 池满说明消费者过多，直接报错
     */
    @Override
    protected boolean defaultConsumerBlocking() {
        return options.getConsumerAcquireBlocking() != null && options.getConsumerAcquireBlocking();
    }

    private ReleasableChannel acquire(CachingConnectionFactory connectionFactory, AcquisitionLimiter limiter,
                                      Object lock, boolean block, Duration timeout) {
        limiter.acquire(block, timeout);
        try {
            Channel channel;
            synchronized (lock) {
                Connection connection = ensureConnection(connectionFactory);
                channel = connection.createChannel(false);
            }
            return new ReleasableChannel(channel, () -> {
                try {
                    closeChannelQuietly(channel);
                } finally {
                    limiter.release();
                }
            });
        } catch (RuntimeException e) {
            limiter.release();
            throw reraiseAsLibraryError(e);
        }
    }

    /**
     * 一条连接上的 Channel 由 amqp-client 保证线程安全
     */
    @Override
    public boolean isChannelThreadSafe() {
        return true;
    }

    @Override
    public void close() {
        synchronized (consumerLock) {
            resetQuietly(consumerConnectionFactory, "consumer");
        }
        synchronized (producerLock) {
            resetQuietly(producerConnectionFactory, "producer");
        }
    }

    private void resetQuietly(CachingConnectionFactory connectionFactory, String role) {
        try {
            connectionFactory.resetConnection();
            log.info("✓ [ConnectionHolder] {} 共享连接已关闭", role);
        } catch (AmqpException e) {
            log.error("✗ [ConnectionHolder] 关闭 {} 共享连接失败: {}", role, e.getMessage(), e);
        }
    }
}
