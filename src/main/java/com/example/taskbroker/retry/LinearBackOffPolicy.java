package com.example.taskbroker.retry;

import java.time.Duration;

import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.BackOffPolicy;
import org.springframework.retry.backoff.Sleeper;

/**
 * 线性递增退避：start, start + step, start + 2 * step ... 不超过 max
 *
 * 每次等待之前调用 errback
 */
public class LinearBackOffPolicy implements BackOffPolicy {

    private final RetrySettings settings;
    private final RetryErrback errback;
    private final Sleeper sleeper;

    public LinearBackOffPolicy(RetrySettings settings, RetryErrback errback, Sleeper sleeper) {
        this.settings = settings;
        this.errback = errback;
        this.sleeper = sleeper;
    }

    @Override
    public BackOffContext start(RetryContext context) {
        return new LinearBackOffContext(context);
    }

    @Override
    public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
        LinearBackOffContext context = (LinearBackOffContext) backOffContext;
        Duration sleep = intervalFor(context.attempt++);
        if (errback != null) {
            errback.onRetry(context.retryContext.getLastThrowable(), sleep);
        }
        try {
            sleeper.sleep(sleep.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackOffInterruptedException("重试等待被中断", e);
        }
    }

    Duration intervalFor(int attempt) {
        Duration interval = settings.getIntervalStart().plus(settings.getIntervalStep().multipliedBy(attempt));
        return interval.compareTo(settings.getIntervalMax()) > 0 ? settings.getIntervalMax() : interval;
    }

    private static class LinearBackOffContext implements BackOffContext {

        private final transient RetryContext retryContext;
        private int attempt;

        LinearBackOffContext(RetryContext retryContext) {
            this.retryContext = retryContext;
        }
    }
}
