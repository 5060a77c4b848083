package com.example.taskbroker.broker;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.amqp.core.Queue;

import com.example.taskbroker.codec.JacksonMessageCodec;
import com.example.taskbroker.connection.BrokerChannel;
import com.example.taskbroker.connection.BrokerProducer;
import com.example.taskbroker.connection.ConnectionHolder;
import com.example.taskbroker.consumer.TaskConsumer;
import com.example.taskbroker.exception.BrokerChannelException;
import com.example.taskbroker.exception.ConfigurationException;
import com.example.taskbroker.exception.DelayTooLongException;
import com.example.taskbroker.exception.NoRouteException;
import com.example.taskbroker.exception.QueueJoinTimeoutException;
import com.example.taskbroker.model.ActorDescriptor;
import com.example.taskbroker.model.TaskMessage;
import com.example.taskbroker.retry.RetryableCall;
import com.example.taskbroker.support.AmqpErrors;
import com.example.taskbroker.topology.DefaultQueueTopology;
import com.example.taskbroker.topology.TopologyConfig;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.CancelCallback;
import com.rabbitmq.client.DeliverCallback;

/**
 * RabbitTaskBroker 单元测试
 */
@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class RabbitTaskBrokerTest {

    @Mock
    private ConnectionHolder connectionHolder;

    @Mock
    private BrokerChannel channel;

    @Mock
    private BrokerProducer producer;

    @Mock
    private BrokerListener listener;

    private BrokerOptions options;
    private RabbitTaskBroker broker;

    @BeforeEach
    void setUp() {
        when(connectionHolder.retryOverTime(any(), any(), any()))
                .thenAnswer(invocation -> invocation.<RetryableCall<?>>getArgument(0).call());
        when(connectionHolder.acquireConsumerChannel()).thenReturn(channel);
        when(connectionHolder.acquireProducer(anyBoolean(), any())).thenReturn(producer);
        when(connectionHolder.withConsumerChannel(any())).thenCallRealMethod();
        when(channel.isOpen()).thenReturn(true);

        TopologyConfig config = new TopologyConfig();
        config.setMaxDelayTime(Duration.ofHours(1));
        options = new BrokerOptions();
        options.setDefaultQueueName("tasks");
        broker = new RabbitTaskBroker(connectionHolder, new DefaultQueueTopology(config),
                new JacksonMessageCodec(), options);
        broker.addListener(listener);
    }

    private static TaskMessage message(String queueName) {
        return new TaskMessage(queueName, "send_email", List.of("a@example.com"), Map.of());
    }

    private List<String> declaredQueueNames(int times) throws IOException {
        ArgumentCaptor<Queue> captor = ArgumentCaptor.forClass(Queue.class);
        verify(channel, times(times)).queueDeclare(captor.capture());
        return captor.getAllValues().stream().map(Queue::getName).collect(Collectors.toList());
    }

    private void verifyPublished(int times, String routingKey) throws Exception {
        verify(producer, times(times)).publish(eq(""), eq(routingKey), any(), any(),
                eq(true), eq(true), any());
    }

    @Test
    void testConstruct_MissingCollaborators() {
        assertThrows(ConfigurationException.class,
                () -> new RabbitTaskBroker(null, new DefaultQueueTopology(), new JacksonMessageCodec(), options));
        assertThrows(ConfigurationException.class,
                () -> new RabbitTaskBroker(connectionHolder, null, new JacksonMessageCodec(), options));
        assertThrows(ConfigurationException.class,
                () -> new RabbitTaskBroker(connectionHolder, new DefaultQueueTopology(), null, options));
    }

    @Test
    void testDeclareQueue_IdempotentWithoutBrokerTraffic() {
        // When
        broker.declareQueue("emails");
        broker.declareQueue("emails");
        broker.declareQueue("emails.DQ");

        // Then
        assertEquals(Set.of("emails"), broker.getDeclaredQueues());
        assertEquals(Set.of("emails.DQ"), broker.getDeclaredDelayQueues());
        verify(listener, times(1)).beforeDeclareQueue("emails");
        verify(listener, times(1)).afterDeclareQueue("emails");
        verify(listener, times(1)).afterDeclareDelayQueue("emails.DQ");
        verify(connectionHolder, never()).acquireConsumerChannel();
    }

    @Test
    void testDeclareQueue_ConcurrentCallersNotifyOnce() throws Exception {
        // Given
        AtomicInteger notifications = new AtomicInteger();
        broker.addListener(new BrokerListener() {
            @Override
            public void afterDeclareQueue(String queueName) {
                notifications.incrementAndGet();
            }
        });
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        // When
        for (int i = 0; i < 8; i++) {
            executor.submit(() -> {
                start.await();
                broker.declareQueue("reports");
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        // Then
        assertEquals(1, notifications.get());
    }

    @Test
    void testEnqueue_EnsuresDeadLetterThenDelayThenCanonical() throws Exception {
        // When
        TaskMessage enqueued = broker.enqueue(message("emails"));
        broker.enqueue(message("emails"));

        // Then
        assertEquals(List.of("emails.XQ", "emails.DQ", "emails"), declaredQueueNames(3));
        verifyPublished(2, "emails");
        assertEquals("emails", enqueued.getQueueName());
        verify(listener).beforeEnqueue(enqueued, null);
        verify(listener).afterEnqueue(enqueued, null);
    }

    @Test
    void testEnqueue_DelayedMessageGoesToDelayQueue() throws Exception {
        // Given
        long before = System.currentTimeMillis();

        // When
        TaskMessage enqueued = broker.enqueue(message("emails"), 5000L);

        // Then
        assertEquals("emails.DQ", enqueued.getQueueName());
        long eta = ((Number) enqueued.getOption("eta")).longValue();
        assertTrue(eta >= before + 5000L);

        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(producer).publish(eq(""), eq("emails.DQ"), properties.capture(), any(),
                anyBoolean(), anyBoolean(), any());
        assertEquals("5000", properties.getValue().getExpiration());
    }

    @Test
    void testEnqueue_DelayTooLongRejectedWithoutPublish() throws Exception {
        // When
        DelayTooLongException error = assertThrows(DelayTooLongException.class,
                () -> broker.enqueue(message("emails"), Duration.ofHours(2).toMillis()));

        // Then
        assertEquals(7_200_000L, error.getDelay());
        assertEquals(3_600_000L, error.getMaxDelay());
        assertEquals("emails", error.getQueueName());
        verify(producer, never()).publish(any(), any(), any(), any(), anyBoolean(), anyBoolean(), any());
    }

    @Test
    void testEnqueue_NoRouteRedeclaresAndRetriesOnce() throws Exception {
        // Given
        doThrow(new NoRouteException("NO_ROUTE", "", "emails"))
                .doNothing()
                .when(producer).publish(any(), any(), any(), any(), anyBoolean(), anyBoolean(), any());

        // When
        broker.enqueue(message("emails"));

        // Then
        verifyPublished(2, "emails");
        assertEquals(List.of("emails.XQ", "emails.DQ", "emails", "emails.XQ", "emails.DQ", "emails"),
                declaredQueueNames(6));
    }

    @Test
    void testEnqueue_SecondNoRoutePropagates() throws Exception {
        // Given
        doThrow(new NoRouteException("NO_ROUTE", "", "emails"))
                .when(producer).publish(any(), any(), any(), any(), anyBoolean(), anyBoolean(), any());

        // Then
        assertThrows(NoRouteException.class, () -> broker.enqueue(message("emails")));
        verifyPublished(2, "emails");
        verify(listener, never()).afterEnqueue(any(), any());
    }

    @Test
    void testConsume_MissingQueueIsRedeclared() throws Exception {
        // Given
        when(channel.basicConsume(eq("emails"), any(DeliverCallback.class), any(CancelCallback.class)))
                .thenThrow(AmqpErrors.channelError(404, "NOT_FOUND - no queue 'emails'"));
        List<String> started = new ArrayList<>();
        broker.onConsumeStarted(started::add);

        // When
        TaskConsumer consumer = broker.consume("emails", 10, Duration.ofMillis(10));

        // Then
        assertNotNull(consumer);
        assertEquals(List.of("emails.XQ", "emails.DQ", "emails"), declaredQueueNames(3));
        assertEquals(List.of("emails"), started);
        verify(channel).release();
        verify(connectionHolder, times(5)).acquireConsumerChannel();
    }

    @Test
    void testConsume_ExistingQueueLeavesPending() throws Exception {
        // Given
        when(channel.basicConsume(eq("emails"), any(DeliverCallback.class), any(CancelCallback.class)))
                .thenReturn("ctag-1");
        broker.declareQueue("emails");
        assertTrue(broker.pendingQueues().contains("emails"));

        // When
        broker.consume("emails", 10, Duration.ofMillis(10));

        // Then
        assertFalse(broker.pendingQueues().contains("emails"));
        verify(channel).basicCancel("ctag-1");
        verify(channel, never()).queueDeclare(any());
    }

    @Test
    void testFlush_SkipsPendingQueue() throws Exception {
        // Given
        broker.declareQueue("emails");

        // When
        broker.flush("emails");

        // Then
        verify(channel, never()).queuePurge(any());
    }

    @Test
    void testFlushAll_PurgesAllThreeQueues() throws Exception {
        // Given
        broker.declareQueue("emails", true);

        // When
        broker.flushAll();

        // Then
        verify(channel).queuePurge("emails");
        verify(channel).queuePurge("emails.DQ");
        verify(channel).queuePurge("emails.XQ");
    }

    @Test
    void testDeleteQueue_AbsorbsNotAllowedAndMarksPending() throws Exception {
        // Given
        broker.declareQueue("emails", true);
        doThrow(AmqpErrors.connectionError(530, "NOT_ALLOWED"))
                .when(channel).queueDelete("emails.DQ", false, false);

        // When
        broker.deleteQueue("emails");

        // Then
        verify(channel).queueDelete("emails", false, false);
        verify(channel).queueDelete("emails.XQ", false, false);
        assertTrue(broker.pendingQueues().contains("emails"));
        assertFalse(broker.getDeclaredQueues().contains("emails"));

        // 下次入队重新声明
        broker.enqueue(message("emails"));
        assertEquals(6, declaredQueueNames(6).size());
    }

    @Test
    void testDeleteQueue_OtherErrorsPropagate() throws Exception {
        // Given
        doThrow(AmqpErrors.channelError(406, "PRECONDITION_FAILED - queue not empty"))
                .when(channel).queueDelete("emails", false, true);

        // Then
        assertThrows(BrokerChannelException.class, () -> broker.deleteQueue("emails", false, true));
    }

    @Test
    void testDeleteAll_IncludesPendingQueues() throws Exception {
        // Given
        broker.declareQueue("emails", true);
        broker.deleteQueue("emails");
        broker.declareQueue("reports");

        // When
        broker.deleteAll(true);

        // Then
        verify(channel, times(2)).queueDelete("emails", false, false);
        verify(channel).queueDelete("reports", false, false);
    }

    @Test
    void testGetQueueMessageCounts() throws Exception {
        // Given
        when(channel.messageCount("emails")).thenReturn(3L);
        when(channel.messageCount("emails.DQ")).thenReturn(1L);
        when(channel.messageCount("emails.XQ")).thenReturn(0L);

        // Then
        assertArrayEquals(new long[] {3L, 1L, 0L}, broker.getQueueMessageCounts("emails"));
    }

    @Test
    void testJoin_ReturnsAfterConsecutiveEmptyChecks() throws Exception {
        // Given
        when(channel.messageCount("emails")).thenReturn(2L, 0L, 0L);
        when(channel.messageCount("emails.DQ")).thenReturn(0L);

        // When
        broker.join("emails", 2, Duration.ofMillis(1), Duration.ofSeconds(5));

        // Then
        verify(channel, times(3)).messageCount("emails");
    }

    @Test
    void testJoin_Timeout() throws Exception {
        // Given
        when(channel.messageCount("emails")).thenReturn(1L);

        // Then
        QueueJoinTimeoutException error = assertThrows(QueueJoinTimeoutException.class,
                () -> broker.join("emails", 2, Duration.ofMillis(5), Duration.ofMillis(30)));
        assertEquals("emails", error.getQueueName());
    }

    @Test
    void testDeclareActor_DefaultQueueRewritten() {
        // Given
        ActorDescriptor actor = new ActorDescriptor("send_email", "default");

        // When
        broker.declareActor(actor);

        // Then
        assertEquals("tasks", broker.getActor("send_email").getQueueName());
        assertEquals(Set.of("send_email"), broker.getDeclaredActors());
        assertTrue(broker.getDeclaredQueues().contains("tasks"));
        verify(listener).afterDeclareActor(actor);
    }

    @Test
    void testClose_SecondCallIsNoOp() {
        // Given
        AtomicInteger closed = new AtomicInteger();
        broker.onClose(closed::incrementAndGet);

        // When
        broker.close();
        broker.close();

        // Then
        verify(connectionHolder, times(1)).close();
        assertEquals(1, closed.get());
        assertTrue(broker.isClosed());
    }
}
