package com.example.taskbroker.exception;

/**
 * 配置错误，构造阶段即失败
 */
public class ConfigurationException extends TaskBrokerException {

    public ConfigurationException(String message) {
        super(message);
    }
}
