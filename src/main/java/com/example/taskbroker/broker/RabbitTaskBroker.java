package com.example.taskbroker.broker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import com.example.taskbroker.codec.MessageCodec;
import com.example.taskbroker.connection.BrokerChannel;
import com.example.taskbroker.connection.ChannelCallback;
import com.example.taskbroker.connection.ConnectionHolder;
import com.example.taskbroker.constant.BrokerConstants;
import com.example.taskbroker.constant.BrokerConstants.MessageOption;
import com.example.taskbroker.constant.BrokerConstants.ReplyCode;
import com.example.taskbroker.consumer.TaskConsumer;
import com.example.taskbroker.exception.BrokerConnectionException;
import com.example.taskbroker.exception.ConfigurationException;
import com.example.taskbroker.exception.DelayTooLongException;
import com.example.taskbroker.exception.NoRouteException;
import com.example.taskbroker.exception.QueueJoinTimeoutException;
import com.example.taskbroker.exception.QueueNotFoundException;
import com.example.taskbroker.exception.TaskBrokerException;
import com.example.taskbroker.model.ActorDescriptor;
import com.example.taskbroker.model.TaskMessage;
import com.example.taskbroker.publisher.MessagePublisher;
import com.example.taskbroker.topology.QueueNames;
import com.example.taskbroker.topology.QueueTopology;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 基于 RabbitMQ 的任务 Broker
 *
 * 每个逻辑队列在 Broker 上的状态：
 * <pre>
 *   UNKNOWN --declareQueue--> PENDING --ensure--> ENSURED
 *      ^                         ^                   |
 *      |                         +----deleteQueue----+
 *      +--------- 队列被外部删除（NO_ROUTE / 404）---------+
 * </pre>
 * PENDING 表示本地已登记但尚未在 Broker 上声明；
 * 第一次 enqueue / consume 时依次声明 死信队列、延迟队列、主队列
 */
@Slf4j
public class RabbitTaskBroker implements AutoCloseable {

    @Getter
    private final ConnectionHolder connectionHolder;

    @Getter
    private final QueueTopology topology;

    private final MessageCodec codec;
    private final BrokerOptions options;
    private final MessagePublisher publisher;
    private final QueueRegistry registry = new QueueRegistry();
    private final Map<String, ActorDescriptor> actors = new ConcurrentHashMap<>();
    private final List<BrokerListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<String>> consumeStartedCallbacks = new CopyOnWriteArrayList<>();
    private final List<Runnable> closeCallbacks = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RabbitTaskBroker(ConnectionHolder connectionHolder, QueueTopology topology,
                            MessageCodec codec, BrokerOptions options) {
        if (connectionHolder == null) {
            throw new ConfigurationException("connectionHolder 不能为空");
        }
        if (topology == null) {
            throw new ConfigurationException("topology 不能为空");
        }
        if (codec == null) {
            throw new ConfigurationException("codec 不能为空");
        }
        this.connectionHolder = connectionHolder;
        this.topology = topology;
        this.codec = codec;
        this.options = options == null ? new BrokerOptions() : options;
        this.publisher = new MessagePublisher(connectionHolder, codec, this.options);
    }

    // ========== 回调 ==========

    public void addListener(BrokerListener listener) {
        listeners.add(listener);
    }

    /**
     * 每次 consume 成功后以队列名回调
     */
    public void onConsumeStarted(Consumer<String> callback) {
        consumeStartedCallbacks.add(callback);
    }

    public void onClose(Runnable callback) {
        closeCallbacks.add(callback);
    }

    // ========== Actor ==========

    /**
     * 登记 Actor 并声明其队列；"default" 队列会被替换为配置的默认队列
     */
    public void declareActor(ActorDescriptor actor) {
        if (BrokerConstants.DEFAULT_QUEUE_NAME.equals(actor.getQueueName())
                && !BrokerConstants.DEFAULT_QUEUE_NAME.equals(options.getDefaultQueueName())) {
            log.debug("[Broker] Actor {} 使用默认队列 {}", actor.getActorName(), options.getDefaultQueueName());
            actor.setQueueName(options.getDefaultQueueName());
        }
        listeners.forEach(listener -> listener.beforeDeclareActor(actor));
        declareQueue(actor.getQueueName());
        actors.put(actor.getActorName(), actor);
        listeners.forEach(listener -> listener.afterDeclareActor(actor));
    }

    public ActorDescriptor getActor(String actorName) {
        return actors.get(actorName);
    }

    public Set<String> getDeclaredActors() {
        return Set.copyOf(actors.keySet());
    }

    // ========== 队列声明 ==========

    public void declareQueue(String queueName) {
        declareQueue(queueName, false);
    }

    /**
     * 登记队列（UNKNOWN → PENDING），每个队列只通知一次监听器
     *
     * @param ensure 是否立即在 Broker 上声明
     */
    public void declareQueue(String queueName, boolean ensure) {
        String canonical = topology.canonicalName(queueName);
        if (!registry.isDeclared(canonical)) {
            registry.withLock(() -> {
                if (registry.isDeclared(canonical)) {
                    return;
                }
                listeners.forEach(listener -> listener.beforeDeclareQueue(canonical));
                String delayed = topology.delayName(canonical);
                registry.markDeclared(canonical, delayed);
                listeners.forEach(listener -> listener.afterDeclareQueue(canonical));
                listeners.forEach(listener -> listener.afterDeclareDelayQueue(delayed));
            });
        }
        if (ensure) {
            registry.withLock(() -> ensureQueue(canonical));
        }
    }

    /**
     * 在 Broker 上声明 PENDING 的物理队列，顺序：死信队列、延迟队列、主队列
     *
     * 某个队列声明失败时，剩余队列保持 PENDING
     */
    private void ensureQueue(String canonical) {
        QueueNames names = topology.resolve(canonical);
        if (registry.isPending(names.getCanonical())) {
            registry.markPending(names.getDelayed());
            registry.markPending(names.getDeadLetter());
        }
        ensureDeclared(names.getDeadLetter(),
                channel -> topology.declareDeadLetterQueue(channel, canonical, true));
        ensureDeclared(names.getDelayed(),
                channel -> topology.declareDelayQueue(channel, canonical, true));
        ensureDeclared(names.getCanonical(),
                channel -> topology.declareCanonicalQueue(channel, canonical, true));
    }

    private void ensureDeclared(String queueName, ChannelCallback<?> declare) {
        if (!registry.isPending(queueName)) {
            return;
        }
        connectionHolder.retryOverTime(() -> {
            try (BrokerChannel channel = connectionHolder.acquireConsumerChannel()) {
                declare.doInChannel(channel);
            }
            return null;
        }, options.declareRetrySettings(), this::onConnectionError);
        registry.markEnsured(queueName);
        log.info("✓ [Broker] 队列已声明: {}", queueName);
    }

    public Set<String> getDeclaredQueues() {
        return registry.getDeclared();
    }

    public Set<String> getDeclaredDelayQueues() {
        return registry.getDelayQueues();
    }

    // ========== 入队 ==========

    public TaskMessage enqueue(TaskMessage message) {
        return enqueue(message, null);
    }

    /**
     * 发布消息
     *
     * @param delay 延迟毫秒数，为空表示立即投递；延迟消息进入延迟队列，到期后回到主队列
     * @return 实际发布的消息（延迟消息为改写后的副本）
     * @throws DelayTooLongException delay 超过 maxDelayTime
     */
    public TaskMessage enqueue(TaskMessage message, Long delay) {
        String queueName = message.getQueueName();
        declareQueue(queueName, true);

        if (delay != null) {
            if (delay < 0) {
                throw new IllegalArgumentException("delay 不能为负数: " + delay);
            }
            Duration maxDelay = topology.getMaxDelayTime();
            if (maxDelay != null && delay > maxDelay.toMillis()) {
                throw new DelayTooLongException(delay, maxDelay.toMillis(), queueName);
            }
            queueName = topology.delayName(queueName);
            message = message.copy(queueName, Map.of(MessageOption.ETA, System.currentTimeMillis() + delay));
        }

        TaskMessage enqueued = message;
        String target = queueName;
        log.debug("→ [Broker] 消息入队: id={}, queue={}, delay={}", enqueued.getMessageId(), target, delay);
        listeners.forEach(listener -> listener.beforeEnqueue(enqueued, delay));
        try {
            publisher.publish(target, enqueued, delay);
        } catch (NoRouteException e) {
            // 队列可能在 Broker 上被删除，重新声明后只重试一次
            log.warn("⚠ [Broker] 消息无法路由到 {}，重新声明队列后重试: {}", target, e.getMessage());
            registry.withLock(() -> {
                registry.forget(topology.canonicalName(target));
                declareQueue(target, true);
            });
            publisher.publish(target, enqueued, delay);
        }
        listeners.forEach(listener -> listener.afterEnqueue(enqueued, delay));
        return enqueued;
    }

    // ========== 消费 ==========

    /**
     * 创建消费者；队列在 Broker 上不存在时重新声明
     *
     * @param prefetch 最多未确认的消息数
     * @param timeout  每次拉取的等待时间
     */
    public TaskConsumer consume(String queueName, int prefetch, Duration timeout) {
        TaskConsumer consumer = createConsumer(queueName, prefetch, timeout);
        try {
            consumer.check();
            registry.withLock(() -> registry.markEnsured(queueName));
        } catch (QueueNotFoundException e) {
            log.info("⚠ [Broker] 队列 {} 不存在，重新声明", queueName);
            consumer.close();
            registry.withLock(() -> {
                registry.forget(topology.canonicalName(queueName));
                declareQueue(queueName, true);
            });
            // 404 之后 Broker 已关闭原 Channel
            consumer = createConsumer(queueName, prefetch, timeout);
        } catch (RuntimeException e) {
            consumer.close();
            throw e;
        }
        consumeStartedCallbacks.forEach(callback -> callback.accept(queueName));
        log.info("✓ [Broker] 开始消费队列: {}, prefetch={}", queueName, prefetch);
        return consumer;
    }

    private TaskConsumer createConsumer(String queueName, int prefetch, Duration timeout) {
        BrokerChannel channel = connectionHolder.acquireConsumerChannel();
        try {
            return new TaskConsumer(channel, queueName, prefetch, timeout, codec,
                    connectionHolder.isChannelThreadSafe(),
                    options.isBlockingAcknowledge(), options.getAcknowledgeTimeout());
        } catch (RuntimeException e) {
            channel.release();
            throw e;
        }
    }

    // ========== 队列管理 ==========

    /**
     * 消息数：[主队列, 延迟队列, 死信队列]
     */
    public long[] getQueueMessageCounts(String queueName) {
        QueueNames names = topology.resolve(queueName);
        return connectionHolder.withConsumerChannel(channel -> new long[] {
                channel.messageCount(names.getCanonical()),
                channel.messageCount(names.getDelayed()),
                channel.messageCount(names.getDeadLetter())
        });
    }

    /**
     * 清空队列的三个物理队列；尚未在 Broker 上声明的队列跳过
     */
    public void flush(String queueName) {
        QueueNames names = topology.resolve(queueName);
        if (registry.isPending(names.getCanonical())) {
            log.debug("[Broker] 队列 {} 尚未声明，跳过清空", names.getCanonical());
            return;
        }
        connectionHolder.withConsumerChannel(channel -> {
            for (String name : names.asList()) {
                channel.queuePurge(name);
            }
            return null;
        });
        log.info("✓ [Broker] 队列已清空: {}", names.getCanonical());
    }

    public void flushAll() {
        for (String queueName : registry.getDeclared()) {
            flush(queueName);
        }
    }

    /**
     * 删除队列的三个物理队列，之后队列回到 PENDING，下次使用时重新声明
     *
     * NOT_ALLOWED / RESOURCE_LOCKED 视为已删除或无法删除，不抛出
     */
    public void deleteQueue(String queueName, boolean ifUnused, boolean ifEmpty) {
        QueueNames names = topology.resolve(queueName);
        registry.withLock(() -> {
            for (String name : names.asList()) {
                deletePhysicalQueue(name, ifUnused, ifEmpty);
            }
            registry.forget(names.getCanonical());
            registry.markPending(names.getCanonical());
        });
    }

    public void deleteQueue(String queueName) {
        deleteQueue(queueName, false, false);
    }

    private void deletePhysicalQueue(String name, boolean ifUnused, boolean ifEmpty) {
        try {
            connectionHolder.withConsumerChannel(channel -> {
                channel.queueDelete(name, ifUnused, ifEmpty);
                return null;
            });
            log.info("✓ [Broker] 队列已删除: {}", name);
        } catch (BrokerConnectionException e) {
            if (e.getReplyCode() != ReplyCode.NOT_ALLOWED && e.getReplyCode() != ReplyCode.RESOURCE_LOCKED) {
                throw e;
            }
            log.info("⚠ [Broker] 队列 {} 无法删除，跳过: {}", name, e.getMessage());
        }
    }

    /**
     * @param includePending 是否包括尚未在 Broker 上声明的队列
     */
    public void deleteAll(boolean includePending) {
        Set<String> queueNames = new LinkedHashSet<>(registry.getDeclared());
        if (includePending) {
            queueNames.addAll(registry.getPending());
        }
        Set<String> canonicalNames = new LinkedHashSet<>();
        for (String queueName : queueNames) {
            canonicalNames.add(topology.canonicalName(queueName));
        }
        for (String canonical : canonicalNames) {
            deleteQueue(canonical);
        }
    }

    /**
     * 等待主队列和延迟队列连续 minSuccesses 次为空，只用于测试
     *
     * @param idleTime 两次检查的间隔
     * @param timeout  最长等待时间，null 表示一直等待
     * @throws QueueJoinTimeoutException 超时
     */
    public void join(String queueName, int minSuccesses, Duration idleTime, Duration timeout) {
        long deadline = timeout == null ? Long.MAX_VALUE : System.nanoTime() + timeout.toNanos();
        int successes = 0;
        while (successes < minSuccesses) {
            if (System.nanoTime() >= deadline) {
                throw new QueueJoinTimeoutException(queueName);
            }
            long[] counts = getQueueMessageCounts(queueName);
            successes = counts[0] + counts[1] == 0 ? successes + 1 : 0;
            if (successes < minSuccesses) {
                sleep(idleTime);
            }
        }
    }

    public void join(String queueName, Duration timeout) {
        join(queueName, 2, Duration.ofMillis(100), timeout);
    }

    private static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskBrokerException("等待队列清空时线程被中断", e);
        }
    }

    // ========== 关闭 ==========

    /**
     * 关闭所有连接并执行 onClose 回调；重复调用不做任何事
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            connectionHolder.close();
            log.info("✓ [Broker] 已关闭");
        } finally {
            List<Runnable> callbacks = new ArrayList<>(closeCallbacks);
            callbacks.forEach(Runnable::run);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    private void onConnectionError(Throwable error, Duration sleep) {
        log.warn("⟳ [Broker] 连接异常，{} 秒后重试: {}", sleep.toMillis() / 1000.0, error.toString(), error);
    }

    Collection<String> pendingQueues() {
        return registry.getPending();
    }
}
