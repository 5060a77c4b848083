package com.example.taskbroker.retry;

/**
 * 可重试的调用
 */
@FunctionalInterface
public interface RetryableCall<T> {

    T call() throws Exception;
}
