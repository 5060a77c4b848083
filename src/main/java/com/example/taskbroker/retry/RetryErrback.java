package com.example.taskbroker.retry;

import java.time.Duration;

/**
 * 每次重试前回调，参数为本次失败的异常和即将等待的时间
 */
@FunctionalInterface
public interface RetryErrback {

    void onRetry(Throwable error, Duration sleep);
}
