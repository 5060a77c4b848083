package com.example.taskbroker.connection;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.TimeoutException;

import org.springframework.amqp.AmqpAuthenticationException;
import org.springframework.amqp.AmqpConnectException;
import org.springframework.amqp.AmqpIOException;

import com.example.taskbroker.constant.BrokerConstants.ReplyCode;
import com.example.taskbroker.exception.BrokerChannelException;
import com.example.taskbroker.exception.BrokerConnectionException;
import com.example.taskbroker.exception.QueueNotFoundException;
import com.example.taskbroker.exception.TaskBrokerException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * 传输层异常的分类与转换
 *
 * RabbitMQ Java 客户端把 Broker 关闭 Channel / Connection 的原因放在 ShutdownSignalException 中，
 * 通常被包装在 IOException 或 Spring 的 AmqpException 里，这里沿 cause 链查找
 */
public final class TransportErrors {

    /** 可恢复的 Channel 错误：内容过大、无消费者、资源不足 */
    private static final Set<Integer> RECOVERABLE_CHANNEL_CODES = Set.of(
            ReplyCode.CONTENT_TOO_LARGE, ReplyCode.NO_CONSUMERS, ReplyCode.RESOURCE_ERROR);

    /** 重连也无法解决的连接错误：认证失败、操作不允许 */
    private static final Set<Integer> FATAL_CONNECTION_CODES = Set.of(403, ReplyCode.NOT_ALLOWED);

    private static final int MAX_CAUSE_DEPTH = 16;

    private TransportErrors() {
    }

    public static ShutdownSignalException findShutdownSignal(Throwable error) {
        return findCause(error, ShutdownSignalException.class);
    }

    static <T extends Throwable> T findCause(Throwable error, Class<T> type) {
        Throwable current = error;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return null;
    }

    /**
     * AMQP 响应码，无法确定时返回 -1
     */
    public static int replyCode(Throwable error) {
        if (error instanceof BrokerConnectionException) {
            return ((BrokerConnectionException) error).getReplyCode();
        }
        ShutdownSignalException signal = findShutdownSignal(error);
        if (signal == null) {
            return -1;
        }
        Method reason = signal.getReason();
        if (reason instanceof AMQP.Channel.Close) {
            return ((AMQP.Channel.Close) reason).getReplyCode();
        }
        if (reason instanceof AMQP.Connection.Close) {
            return ((AMQP.Connection.Close) reason).getReplyCode();
        }
        return -1;
    }

    public static String replyText(Throwable error) {
        ShutdownSignalException signal = findShutdownSignal(error);
        if (signal != null) {
            Method reason = signal.getReason();
            if (reason instanceof AMQP.Channel.Close) {
                return ((AMQP.Channel.Close) reason).getReplyText();
            }
            if (reason instanceof AMQP.Connection.Close) {
                return ((AMQP.Connection.Close) reason).getReplyText();
            }
        }
        return error.getMessage() != null ? error.getMessage() : error.toString();
    }

    /**
     * 队列已存在但声明参数不同（406 PRECONDITION_FAILED - inequivalent arg ...）
     */
    public static boolean isInequivalentArguments(Throwable error) {
        return replyCode(error) == ReplyCode.PRECONDITION_FAILED
                && replyText(error).toLowerCase(Locale.ROOT).contains("inequivalent arg");
    }

    /**
     * 可通过重连恢复的错误：网络异常、超时、nack、Broker 关闭连接（认证失败、权限不足除外）
     *
     * 已经转换过的库异常不再重试
     */
    public static boolean isRecoverableConnectionError(Throwable error) {
        if (error == null || error instanceof TaskBrokerException) {
            return false;
        }
        if (findCause(error, AmqpAuthenticationException.class) != null
                || findCause(error, AuthenticationFailureException.class) != null) {
            return false;
        }
        ShutdownSignalException signal = findShutdownSignal(error);
        if (signal != null) {
            return signal.isHardError() && !FATAL_CONNECTION_CODES.contains(replyCode(signal));
        }
        return findCause(error, AmqpConnectException.class) != null
                || findCause(error, AmqpIOException.class) != null
                || findCause(error, IOException.class) != null
                || findCause(error, TimeoutException.class) != null;
    }

    /**
     * 可通过重新打开 Channel 恢复的错误
     */
    public static boolean isRecoverableChannelError(Throwable error) {
        if (error == null || error instanceof TaskBrokerException) {
            return false;
        }
        ShutdownSignalException signal = findShutdownSignal(error);
        return signal != null && !signal.isHardError()
                && RECOVERABLE_CHANNEL_CODES.contains(replyCode(signal));
    }

    /**
     * 转换为库异常：Channel 级错误 → BrokerChannelException（404 → QueueNotFoundException），
     * 其余 → BrokerConnectionException
     */
    public static TaskBrokerException toLibraryError(Throwable error) {
        if (error instanceof TaskBrokerException) {
            return (TaskBrokerException) error;
        }
        if (findCause(error, InterruptedException.class) != null) {
            Thread.currentThread().interrupt();
        }
        int code = replyCode(error);
        String message = replyText(error);
        ShutdownSignalException signal = findShutdownSignal(error);
        if (signal != null && !signal.isHardError()) {
            if (code == ReplyCode.NOT_FOUND) {
                return new QueueNotFoundException(message, error);
            }
            return new BrokerChannelException(message, code, error);
        }
        return new BrokerConnectionException(message, code, error);
    }
}
