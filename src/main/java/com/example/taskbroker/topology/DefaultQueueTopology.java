package com.example.taskbroker.topology;

import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;

import com.example.taskbroker.connection.BrokerChannel;
import com.example.taskbroker.connection.TransportErrors;
import com.example.taskbroker.constant.BrokerConstants.DefaultConfig;
import com.example.taskbroker.constant.BrokerConstants.QueueArgument;
import com.example.taskbroker.constant.BrokerConstants.QueueSuffix;
import com.example.taskbroker.exception.ConfigurationException;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.rabbitmq.client.ShutdownSignalException;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 默认拓扑：延迟消息到期后回到主队列
 *
 * <ul>
 *   <li>主队列：x-dead-letter-exchange → 死信队列，可选 x-max-priority</li>
 *   <li>延迟队列：继承主队列参数，x-dead-letter-* 改为指向主队列；设置了 maxDelayTime 时
 *       以其作为 x-message-ttl 兜底（RabbitMQ 只在队头检查过期，短延迟消息可能被长延迟消息挡住）</li>
 *   <li>死信队列：设置了 deadLetterMessageTtl 时带 x-message-ttl</li>
 * </ul>
 */
@Slf4j
public class DefaultQueueTopology implements QueueTopology {

    @Getter
    private final TopologyConfig config;

    private final LoadingCache<String, QueueNames> names = CacheBuilder.newBuilder()
            .maximumSize(10_000)
            .build(CacheLoader.from(this::computeNames));

    /**
     * @throws ConfigurationException maxDelayTime 或 deadLetterMessageTtl 为负数或超过 RabbitMQ 的上限
     */
    public DefaultQueueTopology(TopologyConfig config) {
        this.config = config.copy();
        checkTtl("maxDelayTime", this.config.getMaxDelayTime());
        checkTtl("deadLetterMessageTtl", this.config.getDeadLetterMessageTtl());
    }

    public DefaultQueueTopology() {
        this(new TopologyConfig());
    }

    @Override
    public QueueNames resolve(String queueName) {
        if (queueName == null || queueName.isBlank()) {
            throw new IllegalArgumentException("队列名不能为空");
        }
        return names.getUnchecked(queueName);
    }

    private QueueNames computeNames(String queueName) {
        String canonical = queueName;
        if (queueName.endsWith(QueueSuffix.DELAYED) || queueName.endsWith(QueueSuffix.DEAD_LETTER)) {
            canonical = queueName.substring(0, queueName.length() - 3);
        }
        return new QueueNames(canonical, canonical + QueueSuffix.DELAYED, canonical + QueueSuffix.DEAD_LETTER);
    }

    @Override
    public Duration getMaxDelayTime() {
        return config.getMaxDelayTime();
    }

    // ========== 队列参数 ==========

    /**
     * 主队列参数
     *
     * @param deadLettering 是否配置死信路由
     */
    protected Map<String, Object> canonicalQueueArguments(String queueName, boolean deadLettering) {
        Map<String, Object> args = new HashMap<>();
        if (deadLettering) {
            args.put(QueueArgument.DEAD_LETTER_EXCHANGE, config.getDlxExchangeName());
            args.put(QueueArgument.DEAD_LETTER_ROUTING_KEY, deadLetterName(queueName));
        }
        if (config.getMaxPriority() != null) {
            args.put(QueueArgument.MAX_PRIORITY, config.getMaxPriority());
        }
        return args;
    }

    /**
     * 延迟队列参数：过期后路由回主队列
     */
    protected Map<String, Object> delayQueueArguments(String queueName) {
        Map<String, Object> args = canonicalQueueArguments(queueName, false);
        args.put(QueueArgument.DEAD_LETTER_EXCHANGE, config.getDlxExchangeName());
        args.put(QueueArgument.DEAD_LETTER_ROUTING_KEY, canonicalName(queueName));
        if (config.getMaxDelayTime() != null) {
            args.put(QueueArgument.MESSAGE_TTL, toMillis(config.getMaxDelayTime()));
        }
        return args;
    }

    protected Map<String, Object> deadLetterQueueArguments(String queueName) {
        Map<String, Object> args = new HashMap<>();
        if (config.getDeadLetterMessageTtl() != null) {
            args.put(QueueArgument.MESSAGE_TTL, toMillis(config.getDeadLetterMessageTtl()));
        }
        return args;
    }

    protected static long toMillis(Duration duration) {
        return duration.toMillis();
    }

    private static void checkTtl(String property, Duration ttl) {
        if (ttl == null) {
            return;
        }
        if (ttl.isNegative() || ttl.toMillis() > DefaultConfig.MAX_MESSAGE_TTL_MILLIS) {
            throw new ConfigurationException(String.format("%s 超出范围 [0, %dms]: %s",
                    property, DefaultConfig.MAX_MESSAGE_TTL_MILLIS, ttl));
        }
    }

    // ========== 声明 ==========

    @Override
    public Queue declareCanonicalQueue(BrokerChannel channel, String queueName,
                                       boolean ignoreDifferentTopology) throws IOException {
        return declareQueue(channel, canonicalName(queueName),
                canonicalQueueArguments(queueName, true), ignoreDifferentTopology);
    }

    @Override
    public Queue declareDelayQueue(BrokerChannel channel, String queueName,
                                   boolean ignoreDifferentTopology) throws IOException {
        return declareQueue(channel, delayName(queueName),
                delayQueueArguments(queueName), ignoreDifferentTopology);
    }

    @Override
    public Queue declareDeadLetterQueue(BrokerChannel channel, String queueName,
                                        boolean ignoreDifferentTopology) throws IOException {
        return declareQueue(channel, deadLetterName(queueName),
                deadLetterQueueArguments(queueName), ignoreDifferentTopology);
    }

    protected Queue buildQueue(String name, Map<String, Object> args) {
        QueueBuilder builder = config.isDurable() ? QueueBuilder.durable(name) : QueueBuilder.nonDurable(name);
        if (config.isAutoDelete()) {
            builder.autoDelete();
        }
        return builder.withArguments(args).build();
    }

    /**
     * 声明队列
     *
     * 队列已存在但参数不同时 Broker 返回 406 PRECONDITION_FAILED（inequivalent arg），
     * ignoreDifferentTopology=true 时只记录日志，其他错误一律抛出
     */
    protected Queue declareQueue(BrokerChannel channel, String name, Map<String, Object> args,
                                 boolean ignoreDifferentTopology) throws IOException {
        Queue queue = buildQueue(name, args);
        log.info("→ [Topology] 声明队列: {}, 参数: {}", name, args);
        try {
            channel.queueDeclare(queue);
        } catch (IOException | ShutdownSignalException e) {
            if (!ignoreDifferentTopology || !TransportErrors.isInequivalentArguments(e)) {
                throw e;
            }
            log.info("⚠ [Topology] 队列 {} 已存在且参数不一致，沿用现有队列: {}",
                    name, TransportErrors.replyText(e));
        }
        return queue;
    }
}
