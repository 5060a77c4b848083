package com.example.taskbroker.exception;

/**
 * 消息体无法解码
 */
public class MessageDecodeException extends TaskBrokerException {

    public MessageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
