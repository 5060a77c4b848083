package com.example.taskbroker.exception;

/**
 * Channel 级错误（连接本身仍可用，Channel 已被 Broker 关闭）
 */
public class BrokerChannelException extends BrokerConnectionException {

    public BrokerChannelException(String message, int replyCode) {
        super(message, replyCode, null);
    }

    public BrokerChannelException(String message, int replyCode, Throwable cause) {
        super(message, replyCode, cause);
    }
}
