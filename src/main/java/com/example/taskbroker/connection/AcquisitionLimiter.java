package com.example.taskbroker.connection;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import com.example.taskbroker.exception.BrokerConnectionException;
import com.example.taskbroker.exception.LimitExceededException;

/**
 * 限制同时借出的连接 / Channel 数量
 */
class AcquisitionLimiter {

    private final String name;
    private final int limit;
    private final Semaphore permits;

    AcquisitionLimiter(String name, Integer limit) {
        this.name = name;
        this.limit = limit == null ? Integer.MAX_VALUE : limit;
        this.permits = new Semaphore(this.limit, true);
    }

    /**
     * @param block   false 时池满立即失败
     * @param timeout block=true 时的最长等待时间，null 表示一直等待
     */
    void acquire(boolean block, Duration timeout) {
        boolean acquired;
        try {
            if (!block) {
                acquired = permits.tryAcquire();
            } else if (timeout == null) {
                permits.acquire();
                acquired = true;
            } else {
                acquired = permits.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrokerConnectionException("等待" + name + "时线程被中断", e);
        }
        if (!acquired) {
            throw new LimitExceededException(String.format("%s已耗尽（上限 %d）", name, limit));
        }
    }

    void release() {
        permits.release();
    }
}
