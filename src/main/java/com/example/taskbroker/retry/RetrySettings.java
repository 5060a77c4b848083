package com.example.taskbroker.retry;

import java.time.Duration;

import lombok.Data;

/**
 * 重试参数
 *
 * 第 n 次重试前等待 min(intervalStart + intervalStep * n, intervalMax)
 */
@Data
public class RetrySettings {

    /** 最大重试次数（不含首次调用），为空表示不限次数 */
    private Integer maxRetries;

    private Duration intervalStart = Duration.ofSeconds(2);

    private Duration intervalStep = Duration.ofSeconds(2);

    private Duration intervalMax = Duration.ofSeconds(30);

    /** 从首次调用开始计算的截止时间，为空表示不限时 */
    private Duration deadline;

    public RetrySettings copy() {
        RetrySettings copy = new RetrySettings();
        copy.setMaxRetries(maxRetries);
        copy.setIntervalStart(intervalStart);
        copy.setIntervalStep(intervalStep);
        copy.setIntervalMax(intervalMax);
        copy.setDeadline(deadline);
        return copy;
    }

    /**
     * 以总尝试次数换算重试次数，attempts 为空表示不限次数
     */
    public RetrySettings withMaxAttempts(Integer attempts) {
        RetrySettings copy = copy();
        copy.setMaxRetries(attempts == null ? null : Math.max(0, attempts - 1));
        return copy;
    }
}
