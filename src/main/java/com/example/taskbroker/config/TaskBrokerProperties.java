package com.example.taskbroker.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import com.example.taskbroker.broker.BrokerOptions;
import com.example.taskbroker.connection.HolderOptions;
import com.example.taskbroker.constant.BrokerConstants;
import com.example.taskbroker.retry.RetrySettings;
import com.example.taskbroker.topology.TopologyConfig;

import lombok.Data;

/**
 * 任务 Broker 配置，前缀 task-broker
 *
 * 连接参数（host、port、用户名等）沿用 spring.rabbitmq.*
 */
@Data
@ConfigurationProperties(prefix = "task-broker")
public class TaskBrokerProperties {

    public enum Strategy {
        /** 每次借出独立连接 */
        POOLED,
        /** 每个角色共享一条连接 */
        SHARED
    }

    private Strategy strategy = Strategy.POOLED;

    private String defaultQueueName = BrokerConstants.DEFAULT_QUEUE_NAME;

    private boolean blockingAcknowledge = true;

    private Duration acknowledgeTimeout = Duration.ofSeconds(30);

    private boolean confirmDelivery = true;

    private Duration confirmTimeout = Duration.ofSeconds(5);

    private Duration maxProducerAcquireTimeout = Duration.ofSeconds(10);

    private Integer maxEnqueueAttempts = 3;

    private Integer maxDeclareAttempts = 3;

    @NestedConfigurationProperty
    private RetrySettings retry = new RetrySettings();

    @NestedConfigurationProperty
    private HolderOptions pool = new HolderOptions();

    @NestedConfigurationProperty
    private TopologyConfig topology = new TopologyConfig();

    public BrokerOptions toBrokerOptions() {
        BrokerOptions options = new BrokerOptions();
        options.setDefaultQueueName(defaultQueueName);
        options.setBlockingAcknowledge(blockingAcknowledge);
        options.setAcknowledgeTimeout(acknowledgeTimeout);
        options.setConfirmDelivery(confirmDelivery);
        options.setConfirmTimeout(confirmTimeout);
        options.setMaxProducerAcquireTimeout(maxProducerAcquireTimeout);
        options.setMaxEnqueueAttempts(maxEnqueueAttempts);
        options.setMaxDeclareAttempts(maxDeclareAttempts);
        options.setRetry(retry.copy());
        return options;
    }
}
