package com.example.taskbroker.connection;

import java.time.Duration;

import com.example.taskbroker.exception.TaskBrokerException;
import com.example.taskbroker.retry.RetryErrback;
import com.example.taskbroker.retry.RetrySettings;
import com.example.taskbroker.retry.RetryableCall;

/**
 * 连接管理
 *
 * 负责借出生产者和消费者 Channel、按策略重试，并把传输层异常转换为库异常。
 * 两种实现：
 * <ul>
 *   <li>{@link PooledConnectionHolder}：每次借出一条独立连接</li>
 *   <li>{@link SharedConnectionHolder}：每个角色共享一条连接，借出其上的 Channel</li>
 * </ul>
 */
public interface ConnectionHolder extends AutoCloseable {

    /**
     * 借出生产者，调用方负责 release
     *
     * @param block   池满时是否等待
     * @param timeout 最长等待时间
     */
    BrokerProducer acquireProducer(boolean block, Duration timeout);

    /**
     * 借出消费者 Channel，调用方负责 release
     */
    BrokerChannel acquireConsumerChannel(boolean block, Duration timeout);

    /**
     * 按 Holder 的默认阻塞方式和超时借出消费者 Channel
     */
    BrokerChannel acquireConsumerChannel();

    boolean isRecoverableConnectionError(Throwable error);

    boolean isRecoverableChannelError(Throwable error);

    /**
     * 调用 call，遇到可恢复错误时按 settings 退避重试，每次重试前调用 errback；
     * 最终失败转换为库异常
     */
    <T> T retryOverTime(RetryableCall<T> call, RetrySettings settings, RetryErrback errback);

    /**
     * 在消费者 Channel 上执行操作，结束后归还
     */
    default <T> T withConsumerChannel(ChannelCallback<T> callback) {
        try (BrokerChannel channel = acquireConsumerChannel()) {
            return callback.doInChannel(channel);
        } catch (TaskBrokerException e) {
            throw e;
        } catch (Exception e) {
            throw TransportErrors.toLibraryError(e);
        }
    }

    /**
     * 消费者 Channel 是否可以在任意线程上 ack
     */
    boolean isChannelThreadSafe();

    /**
     * 关闭所有连接；可重复调用，关闭后再次借出会重新建立连接
     */
    @Override
    void close();
}
