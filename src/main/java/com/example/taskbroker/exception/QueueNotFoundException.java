package com.example.taskbroker.exception;

import com.example.taskbroker.constant.BrokerConstants.ReplyCode;

/**
 * 队列不存在（404 NOT_FOUND）
 */
public class QueueNotFoundException extends BrokerChannelException {

    public QueueNotFoundException(String message, Throwable cause) {
        super(message, ReplyCode.NOT_FOUND, cause);
    }
}
