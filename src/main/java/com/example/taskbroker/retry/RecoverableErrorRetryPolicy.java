package com.example.taskbroker.retry;

import java.util.function.Predicate;

import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryPolicy;
import org.springframework.retry.context.RetryContextSupport;

/**
 * 只重试可恢复的错误，最多 maxRetries 次
 */
public class RecoverableErrorRetryPolicy implements RetryPolicy {

    private final Predicate<Throwable> recoverable;
    private final Integer maxRetries;

    public RecoverableErrorRetryPolicy(Predicate<Throwable> recoverable, Integer maxRetries) {
        this.recoverable = recoverable;
        this.maxRetries = maxRetries;
    }

    @Override
    public boolean canRetry(RetryContext context) {
        Throwable lastThrowable = context.getLastThrowable();
        if (lastThrowable == null) {
            return true;
        }
        if (!recoverable.test(lastThrowable)) {
            return false;
        }
        return maxRetries == null || context.getRetryCount() <= maxRetries;
    }

    @Override
    public RetryContext open(RetryContext parent) {
        return new RetryContextSupport(parent);
    }

    @Override
    public void close(RetryContext context) {
    }

    @Override
    public void registerThrowable(RetryContext context, Throwable throwable) {
        ((RetryContextSupport) context).registerThrowable(throwable);
    }
}
