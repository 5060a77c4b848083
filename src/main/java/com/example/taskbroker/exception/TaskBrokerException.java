package com.example.taskbroker.exception;

/**
 * 所有 Broker 异常的基类
 * 上层代码只依赖该异常体系，不直接依赖 RabbitMQ 客户端的异常类型
 */
public class TaskBrokerException extends RuntimeException {

    public TaskBrokerException(String message) {
        super(message);
    }

    public TaskBrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
