package com.example.taskbroker.connection;

import java.time.Duration;

import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory.CacheMode;
import org.springframework.amqp.rabbit.connection.Connection;

import com.rabbitmq.client.Channel;

import lombok.extern.slf4j.Slf4j;

/**
 * 连接池策略：每次借出一条独立的连接（及其上的一个 Channel）
 *
 * 消费者、生产者各一个 CONNECTION 模式的 CachingConnectionFactory；
 * 归还时关闭 Channel 并把连接放回池中，不会真正关闭连接
 */
@Slf4j
public class PooledConnectionHolder extends AbstractConnectionHolder {

    private final CachingConnectionFactory consumerConnectionFactory;
    private final CachingConnectionFactory producerConnectionFactory;
    private final AcquisitionLimiter consumerLimiter;
    private final AcquisitionLimiter producerLimiter;
    private final Object setupLock = new Object();

    public PooledConnectionHolder(com.rabbitmq.client.ConnectionFactory rabbitConnectionFactory, HolderOptions options) {
        super(options);
        this.consumerConnectionFactory = createPool(rabbitConnectionFactory, this.options.getConsumerPoolSize(), "consumer");
        this.producerConnectionFactory = createPool(rabbitConnectionFactory, this.options.getProducerPoolSize(), "producer");
        this.consumerLimiter = new AcquisitionLimiter("消费者连接池", this.options.getConsumerPoolSize());
        this.producerLimiter = new AcquisitionLimiter("生产者连接池", this.options.getProducerPoolSize());
    }

    PooledConnectionHolder(CachingConnectionFactory consumerConnectionFactory,
                           CachingConnectionFactory producerConnectionFactory,
                           HolderOptions options) {
        super(options);
        this.consumerConnectionFactory = consumerConnectionFactory;
        this.producerConnectionFactory = producerConnectionFactory;
        this.consumerLimiter = new AcquisitionLimiter("消费者连接池", this.options.getConsumerPoolSize());
        this.producerLimiter = new AcquisitionLimiter("生产者连接池", this.options.getProducerPoolSize());
    }

    private CachingConnectionFactory createPool(com.rabbitmq.client.ConnectionFactory rabbitConnectionFactory,
                                                Integer poolSize, String role) {
        CachingConnectionFactory factory = createConnectionFactory(rabbitConnectionFactory, CacheMode.CONNECTION, role);
        factory.setChannelCacheSize(1);
        if (poolSize != null) {
            factory.setConnectionCacheSize(poolSize);
            factory.setConnectionLimit(poolSize);
        }
        return factory;
    }

    @Override
    public BrokerProducer acquireProducer(boolean block, Duration timeout) {
        return new BrokerProducer(acquire(producerConnectionFactory, producerLimiter, block, timeout));
    }

    @Override
    public BrokerChannel acquireConsumerChannel(boolean block, Duration timeout) {
        return acquire(consumerConnectionFactory, consumerLimiter, block, timeout);
    }

    @Override
    protected boolean defaultConsumerBlocking() {
        return options.getConsumerAcquireBlocking() == null || options.getConsumerAcquireBlocking();
    }

    private ReleasableChannel acquire(CachingConnectionFactory connectionFactory, AcquisitionLimiter limiter,
                                      boolean block, Duration timeout) {
        limiter.acquire(block, timeout);
        Connection connection = null;
        try {
            connection = ensureConnection(connectionFactory);
            Channel channel = connection.createChannel(false);
            return new ReleasableChannel(channel, releaseAction(channel, connection, limiter));
        } catch (RuntimeException e) {
            if (connection != null) {
                closeConnectionQuietly(connection);
            }
            limiter.release();
            throw reraiseAsLibraryError(e);
        }
    }

    private Runnable releaseAction(Channel channel, Connection connection, AcquisitionLimiter limiter) {
        return () -> {
            try {
                closeChannelQuietly(channel);
                closeConnectionQuietly(connection);
            } finally {
                limiter.release();
            }
        };
    }

    /**
     * 连接代理的 close() 只是放回池中
     */
    private static void closeConnectionQuietly(Connection connection) {
        try {
            connection.close();
        } catch (AmqpException e) {
            log.warn("⚠ [ConnectionHolder] 归还连接失败: {}", e.getMessage(), e);
        }
    }

    @Override
    public boolean isChannelThreadSafe() {
        return false;
    }

    @Override
    public void close() {
        synchronized (setupLock) {
            resetQuietly(consumerConnectionFactory, "consumer");
            resetQuietly(producerConnectionFactory, "producer");
        }
    }

    private void resetQuietly(CachingConnectionFactory connectionFactory, String role) {
        try {
            connectionFactory.resetConnection();
            log.info("✓ [ConnectionHolder] {} 连接池已关闭", role);
        } catch (AmqpException e) {
            log.error("✗ [ConnectionHolder] 关闭 {} 连接池失败: {}", role, e.getMessage(), e);
        }
    }
}
