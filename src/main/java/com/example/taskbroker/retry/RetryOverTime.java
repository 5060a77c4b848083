package com.example.taskbroker.retry;

import java.util.List;
import java.util.function.Predicate;

import org.springframework.retry.RetryPolicy;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.retry.policy.CompositeRetryPolicy;
import org.springframework.retry.policy.TimeoutRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

/**
 * 按时间重试策略
 *
 * 只有满足任一 recoverable 判定的异常才会重试；不可恢复的异常立即抛出。
 * 重试次数用尽或超过 deadline 后抛出最后一次的异常
 */
public class RetryOverTime {

    private final List<Predicate<Throwable>> recoverable;
    private final RetrySettings settings;
    private final RetryErrback errback;
    private final Sleeper sleeper;

    public RetryOverTime(List<Predicate<Throwable>> recoverable, RetrySettings settings,
                         RetryErrback errback, Sleeper sleeper) {
        this.recoverable = List.copyOf(recoverable);
        this.settings = settings == null ? new RetrySettings() : settings;
        this.errback = errback;
        this.sleeper = sleeper == null ? new ThreadWaitSleeper() : sleeper;
    }

    public RetryOverTime(List<Predicate<Throwable>> recoverable, RetrySettings settings, RetryErrback errback) {
        this(recoverable, settings, errback, null);
    }

    public boolean isRecoverable(Throwable error) {
        return recoverable.stream().anyMatch(predicate -> predicate.test(error));
    }

    public <T> T execute(RetryableCall<T> call) throws Exception {
        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy());
        template.setBackOffPolicy(new LinearBackOffPolicy(settings, errback, sleeper));
        template.setThrowLastExceptionOnExhausted(true);
        return template.<T, Exception>execute(context -> call.call());
    }

    private RetryPolicy retryPolicy() {
        RetryPolicy recoverablePolicy = new RecoverableErrorRetryPolicy(this::isRecoverable, settings.getMaxRetries());
        if (settings.getDeadline() == null) {
            return recoverablePolicy;
        }
        TimeoutRetryPolicy timeoutPolicy = new TimeoutRetryPolicy();
        timeoutPolicy.setTimeout(settings.getDeadline().toMillis());
        CompositeRetryPolicy composite = new CompositeRetryPolicy();
        composite.setPolicies(new RetryPolicy[] {recoverablePolicy, timeoutPolicy});
        return composite;
    }
}
