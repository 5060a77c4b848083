package com.example.taskbroker.exception;

import lombok.Getter;

/**
 * 连接不可用（网络中断、握手失败、连接被 Broker 关闭等）
 * 携带 AMQP 响应码，未知时为 -1
 */
@Getter
public class BrokerConnectionException extends TaskBrokerException {

    private final int replyCode;

    public BrokerConnectionException(String message) {
        this(message, -1, null);
    }

    public BrokerConnectionException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public BrokerConnectionException(String message, int replyCode, Throwable cause) {
        super(message, cause);
        this.replyCode = replyCode;
    }
}
