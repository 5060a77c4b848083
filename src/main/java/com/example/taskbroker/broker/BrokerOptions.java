package com.example.taskbroker.broker;

import java.time.Duration;

import com.example.taskbroker.constant.BrokerConstants;
import com.example.taskbroker.retry.RetrySettings;

import lombok.Data;

/**
 * Broker 行为配置
 */
@Data
public class BrokerOptions {

    /** 声明在 "default" 队列上的 Actor 会被改到这个队列 */
    private String defaultQueueName = BrokerConstants.DEFAULT_QUEUE_NAME;

    /** 默认 ack/nack 是否等待完成 */
    private boolean blockingAcknowledge = true;

    /** 阻塞 ack/nack 的最长等待时间 */
    private Duration acknowledgeTimeout = Duration.ofSeconds(30);

    /** 是否开启 Publisher Confirms，关闭后也无法发现无法路由的消息 */
    private boolean confirmDelivery = true;

    private Duration confirmTimeout = Duration.ofSeconds(5);

    private Duration maxProducerAcquireTimeout = Duration.ofSeconds(10);

    /** 发布的最大尝试次数（含首次），为空表示不限次数 */
    private Integer maxEnqueueAttempts = 3;

    /** 每个物理队列声明的最大尝试次数（含首次），为空表示不限次数 */
    private Integer maxDeclareAttempts = 3;

    /** 重试间隔和截止时间 */
    private RetrySettings retry = new RetrySettings();

    public RetrySettings enqueueRetrySettings() {
        return retry.withMaxAttempts(maxEnqueueAttempts);
    }

    public RetrySettings declareRetrySettings() {
        return retry.withMaxAttempts(maxDeclareAttempts);
    }
}
