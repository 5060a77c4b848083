package com.example.taskbroker.topology;

import java.io.IOException;
import java.time.Duration;

import org.springframework.amqp.core.Queue;

import com.example.taskbroker.connection.BrokerChannel;

/**
 * 队列拓扑：命名规则 + 队列参数 + 声明
 *
 * 每个逻辑队列对应三个物理队列：
 * <pre>
 *   &lt;name&gt;      主队列，消息被 reject 后进入死信队列
 *   &lt;name&gt;.DQ   延迟队列，消息 TTL 到期后被路由回主队列
 *   &lt;name&gt;.XQ   死信队列
 * </pre>
 */
public interface QueueTopology {

    QueueNames resolve(String queueName);

    default String canonicalName(String queueName) {
        return resolve(queueName).getCanonical();
    }

    default String delayName(String queueName) {
        return resolve(queueName).getDelayed();
    }

    default String deadLetterName(String queueName) {
        return resolve(queueName).getDeadLetter();
    }

    /**
     * 允许的最大延迟，null 表示不限制
     */
    Duration getMaxDelayTime();

    Queue declareCanonicalQueue(BrokerChannel channel, String queueName,
                                boolean ignoreDifferentTopology) throws IOException;

    Queue declareDelayQueue(BrokerChannel channel, String queueName,
                            boolean ignoreDifferentTopology) throws IOException;

    Queue declareDeadLetterQueue(BrokerChannel channel, String queueName,
                                 boolean ignoreDifferentTopology) throws IOException;
}
