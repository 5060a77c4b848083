package com.example.taskbroker.topology;

import java.time.Duration;

import lombok.Data;

/**
 * 队列拓扑配置
 *
 * 对应配置前缀 task-broker.topology
 */
@Data
public class TopologyConfig {

    /** 延迟消息过期后的去向 */
    public enum Routing {
        /** 过期后回到主队列（延迟投递） */
        DEFAULT,
        /** 过期后进入死信队列 */
        DLX
    }

    private boolean durable = true;

    private boolean autoDelete = false;

    /** 死信交换机，"" 表示默认交换机 */
    private String dlxExchangeName = "";

    /** 主队列最大优先级，为空表示不启用优先级 */
    private Integer maxPriority;

    /** 死信队列中消息的保留时间，为空表示永久保留 */
    private Duration deadLetterMessageTtl;

    /** 允许的最大延迟，同时作为延迟队列的 x-message-ttl；为空表示不限制 */
    private Duration maxDelayTime;

    private Routing routing = Routing.DEFAULT;

    public TopologyConfig copy() {
        TopologyConfig copy = new TopologyConfig();
        copy.setDurable(durable);
        copy.setAutoDelete(autoDelete);
        copy.setDlxExchangeName(dlxExchangeName);
        copy.setMaxPriority(maxPriority);
        copy.setDeadLetterMessageTtl(deadLetterMessageTtl);
        copy.setMaxDelayTime(maxDelayTime);
        copy.setRouting(routing);
        return copy;
    }
}
