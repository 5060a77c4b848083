package com.example.taskbroker.connection;

import java.time.Duration;

import com.example.taskbroker.retry.RetrySettings;

import lombok.Data;

/**
 * ConnectionHolder 配置
 *
 * 对应配置前缀 task-broker.pool
 */
@Data
public class HolderOptions {

    /** Pooled：消费者连接池大小 */
    private Integer consumerPoolSize = 100;

    /** Pooled：生产者连接池大小 */
    private Integer producerPoolSize = 10;

    /** Shared：消费者 Channel 池大小 */
    private Integer consumerChannelPoolSize = 100;

    /** Shared：生产者 Channel 池大小 */
    private Integer producerChannelPoolSize = 100;

    /** 建立连接的最大重试次数，为空表示不限次数 */
    private Integer connectMaxRetries = 5;

    /** 建立连接的重试间隔和截止时间 */
    private RetrySettings connectRetry = new RetrySettings();

    /** acquireConsumerChannel() 不带参数时是否阻塞等待 */
    private Boolean consumerAcquireBlocking;

    /** acquireConsumerChannel() 不带参数时的最长等待时间 */
    private Duration consumerAcquireTimeout = Duration.ofSeconds(10);

    /** connection_name 客户端属性，为空时使用主机名 */
    private String connectionName;

    public RetrySettings connectRetrySettings() {
        RetrySettings settings = connectRetry.copy();
        settings.setMaxRetries(connectMaxRetries);
        return settings;
    }
}
