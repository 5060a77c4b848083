package com.example.taskbroker.exception;

/**
 * 资源池耗尽（连接池或 Channel 池），不会在内部重试
 */
public class LimitExceededException extends TaskBrokerException {

    public LimitExceededException(String message) {
        super(message);
    }
}
