package com.example.taskbroker.topology;

import java.util.Map;

import com.example.taskbroker.constant.BrokerConstants.QueueArgument;

/**
 * 死信路由拓扑：延迟队列中的消息过期后进入死信队列而不是回到主队列
 *
 * 配合 maxDelayTime 使用，可以把"等待过久"的消息收集到死信队列中审计；
 * 死信队列永久保留消息，deadLetterMessageTtl 始终为空
 */
public class DlxRoutingTopology extends DefaultQueueTopology {

    public DlxRoutingTopology(TopologyConfig config) {
        super(withoutDeadLetterTtl(config));
    }

    public DlxRoutingTopology() {
        this(new TopologyConfig());
    }

    private static TopologyConfig withoutDeadLetterTtl(TopologyConfig config) {
        TopologyConfig copy = config.copy();
        copy.setDeadLetterMessageTtl(null);
        return copy;
    }

    @Override
    protected Map<String, Object> delayQueueArguments(String queueName) {
        Map<String, Object> args = super.delayQueueArguments(queueName);
        args.put(QueueArgument.DEAD_LETTER_ROUTING_KEY, deadLetterName(queueName));
        return args;
    }
}
