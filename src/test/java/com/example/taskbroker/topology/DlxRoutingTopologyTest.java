package com.example.taskbroker.topology;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.taskbroker.constant.BrokerConstants.QueueArgument;

/**
 * DlxRoutingTopology 单元测试
 */
class DlxRoutingTopologyTest {

    @Test
    void testDelayQueueArguments_ExpiryRoutesToDeadLetter() {
        // Given
        TopologyConfig config = new TopologyConfig();
        config.setMaxDelayTime(Duration.ofMinutes(30));
        DlxRoutingTopology topology = new DlxRoutingTopology(config);

        // When
        Map<String, Object> args = topology.delayQueueArguments("emails");

        // Then
        assertEquals("emails.XQ", args.get(QueueArgument.DEAD_LETTER_ROUTING_KEY));
        assertEquals(1_800_000L, args.get(QueueArgument.MESSAGE_TTL));
    }

    @Test
    void testDeadLetterTtlAlwaysUnset() {
        // Given
        TopologyConfig config = new TopologyConfig();
        config.setDeadLetterMessageTtl(Duration.ofDays(1));

        // When
        DlxRoutingTopology topology = new DlxRoutingTopology(config);

        // Then
        assertNull(topology.getConfig().getDeadLetterMessageTtl());
        assertTrue(topology.deadLetterQueueArguments("emails").isEmpty());
        assertEquals(Duration.ofDays(1), config.getDeadLetterMessageTtl());
    }

    @Test
    void testCanonicalQueueArgumentsUnchanged() {
        // Given
        DlxRoutingTopology topology = new DlxRoutingTopology();

        // When
        Map<String, Object> args = topology.canonicalQueueArguments("emails", true);

        // Then
        assertEquals("emails.XQ", args.get(QueueArgument.DEAD_LETTER_ROUTING_KEY));
    }
}
