package com.example.taskbroker.connection;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.Connection;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import com.example.taskbroker.exception.TaskBrokerException;
import com.example.taskbroker.retry.RetryErrback;
import com.example.taskbroker.retry.RetryOverTime;
import com.example.taskbroker.retry.RetrySettings;
import com.example.taskbroker.retry.RetryableCall;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;

import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;

/**
 * ConnectionHolder 公共逻辑：重试、异常转换、建立连接、创建连接工厂
 */
@Slf4j
public abstract class AbstractConnectionHolder implements ConnectionHolder {

    @Getter
    protected final HolderOptions options;

    /** 退避等待的实现，测试时替换为不等待的 Sleeper */
    @Setter
    private Sleeper sleeper = new ThreadWaitSleeper();

    protected AbstractConnectionHolder(HolderOptions options) {
        this.options = options == null ? new HolderOptions() : options;
    }

    @Override
    public boolean isRecoverableConnectionError(Throwable error) {
        return TransportErrors.isRecoverableConnectionError(error);
    }

    @Override
    public boolean isRecoverableChannelError(Throwable error) {
        return TransportErrors.isRecoverableChannelError(error);
    }

    @Override
    public <T> T retryOverTime(RetryableCall<T> call, RetrySettings settings, RetryErrback errback) {
        RetryOverTime retry = new RetryOverTime(
                List.of(this::isRecoverableConnectionError, this::isRecoverableChannelError),
                settings, errback, sleeper);
        try {
            return retry.execute(call);
        } catch (Exception e) {
            throw reraiseAsLibraryError(e);
        }
    }

    protected TaskBrokerException reraiseAsLibraryError(Throwable error) {
        return TransportErrors.toLibraryError(error);
    }

    /**
     * 获取连接，失败时按 connectRetry 重试
     */
    protected Connection ensureConnection(CachingConnectionFactory connectionFactory) {
        return retryOverTime(connectionFactory::createConnection,
                options.connectRetrySettings(), this::onConnectionError);
    }

    protected void onConnectionError(Throwable error, Duration sleep) {
        log.warn("⟳ [ConnectionHolder] Broker 连接异常，{} 秒后重试: {}",
                sleep.toMillis() / 1000.0, error.toString(), error);
    }

    @Override
    public BrokerChannel acquireConsumerChannel() {
        return acquireConsumerChannel(defaultConsumerBlocking(), options.getConsumerAcquireTimeout());
    }

    protected abstract boolean defaultConsumerBlocking();

    /**
     * 关闭 Channel 代理，由 CachingConnectionFactory 决定放回缓存还是丢弃（已被 Broker 关闭的 Channel）
     */
    protected static void closeChannelQuietly(Channel channel) {
        try {
            channel.close();
        } catch (IOException | TimeoutException | ShutdownSignalException | AmqpException e) {
            log.debug("[ConnectionHolder] 关闭 Channel 失败: {}", e.getMessage(), e);
        }
    }

    protected CachingConnectionFactory createConnectionFactory(com.rabbitmq.client.ConnectionFactory rabbitConnectionFactory,
                                                               CachingConnectionFactory.CacheMode cacheMode,
                                                               String role) {
        CachingConnectionFactory factory = new CachingConnectionFactory(rabbitConnectionFactory);
        factory.setCacheMode(cacheMode);
        String connectionName = resolveConnectionName() + ":" + role;
        factory.setConnectionNameStrategy(cf -> connectionName);
        return factory;
    }

    private String resolveConnectionName() {
        if (options.getConnectionName() != null) {
            return options.getConnectionName();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("[ConnectionHolder] 无法获取主机名，使用默认连接名", e);
            return "task-broker";
        }
    }
}
