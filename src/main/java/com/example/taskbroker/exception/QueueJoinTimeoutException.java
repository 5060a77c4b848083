package com.example.taskbroker.exception;

import lombok.Getter;

/**
 * join() 等待队列清空超时
 */
@Getter
public class QueueJoinTimeoutException extends TaskBrokerException {

    private final String queueName;

    public QueueJoinTimeoutException(String queueName) {
        super("等待队列清空超时: " + queueName);
        this.queueName = queueName;
    }
}
