package com.example.taskbroker.exception;

import lombok.Getter;

/**
 * 延迟时间超过拓扑配置的 maxDelayTime
 *
 * 延迟过长的消息会长时间占用延迟队列，并阻塞队头之后 TTL 更短的消息。
 * 请缩短延迟，或调大拓扑的 maxDelayTime。
 */
@Getter
public class DelayTooLongException extends TaskBrokerException {

    /** 请求的延迟（毫秒） */
    private final long delay;

    /** 允许的最大延迟（毫秒） */
    private final long maxDelay;

    private final String queueName;

    public DelayTooLongException(long delay, long maxDelay, String queueName) {
        super(String.format("消息延迟 %dms 超过队列 '%s' 拓扑配置的最大延迟 %dms",
                delay, queueName, maxDelay));
        this.delay = delay;
        this.maxDelay = maxDelay;
        this.queueName = queueName;
    }
}
