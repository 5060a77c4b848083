package com.example.taskbroker.publisher;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.example.taskbroker.broker.BrokerOptions;
import com.example.taskbroker.codec.JacksonMessageCodec;
import com.example.taskbroker.connection.BrokerProducer;
import com.example.taskbroker.connection.ConnectionHolder;
import com.example.taskbroker.exception.NoRouteException;
import com.example.taskbroker.model.TaskMessage;
import com.example.taskbroker.retry.RetryableCall;
import com.example.taskbroker.retry.RetrySettings;
import com.rabbitmq.client.AMQP;

/**
 * MessagePublisher 单元测试
 */
@ExtendWith(MockitoExtension.class)
class MessagePublisherTest {

    @Mock
    private ConnectionHolder connectionHolder;

    @Mock
    private BrokerProducer producer;

    private final JacksonMessageCodec codec = new JacksonMessageCodec();
    private BrokerOptions options;
    private MessagePublisher messagePublisher;
    private TaskMessage testMessage;

    @BeforeEach
    void setUp() throws Exception {
        options = new BrokerOptions();
        messagePublisher = new MessagePublisher(connectionHolder, codec, options);
        testMessage = new TaskMessage("emails", "send_email", List.of("a@example.com"), Map.of());

        when(connectionHolder.retryOverTime(any(), any(), any()))
                .thenAnswer(invocation -> invocation.<RetryableCall<?>>getArgument(0).call());
        when(connectionHolder.acquireProducer(true, options.getMaxProducerAcquireTimeout())).thenReturn(producer);
    }

    @Test
    void testPublish() throws Exception {
        // When
        messagePublisher.publish("emails", testMessage, null);

        // Then
        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        ArgumentCaptor<byte[]> body = ArgumentCaptor.forClass(byte[].class);
        verify(producer, times(1)).publish(eq(""), eq("emails"), properties.capture(), body.capture(),
                eq(true), eq(true), eq(Duration.ofSeconds(5)));
        verify(producer).close();

        assertEquals(2, properties.getValue().getDeliveryMode());
        assertEquals(testMessage.getMessageId(), properties.getValue().getMessageId());
        assertEquals("application/json", properties.getValue().getContentType());
        assertNull(properties.getValue().getExpiration());
        assertArrayEquals(codec.encode(testMessage), body.getValue());
    }

    @Test
    void testPublish_DelayBecomesExpirationAndPriorityIsCopied() throws Exception {
        // Given
        testMessage.getOptions().put("broker_priority", 7);

        // When
        messagePublisher.publish("emails.DQ", testMessage, 1500L);

        // Then
        ArgumentCaptor<AMQP.BasicProperties> properties = ArgumentCaptor.forClass(AMQP.BasicProperties.class);
        verify(producer).publish(eq(""), eq("emails.DQ"), properties.capture(), any(),
                anyBoolean(), anyBoolean(), any());
        assertEquals("1500", properties.getValue().getExpiration());
        assertEquals(7, properties.getValue().getPriority());
    }

    @Test
    void testPublish_UsesEnqueueRetrySettings() {
        // When
        messagePublisher.publish("emails", testMessage, null);

        // Then
        ArgumentCaptor<RetrySettings> settings = ArgumentCaptor.forClass(RetrySettings.class);
        verify(connectionHolder).retryOverTime(any(), settings.capture(), any());
        assertEquals(2, settings.getValue().getMaxRetries());
    }

    @Test
    void testPublish_NoRouteReleasesProducerAndPropagates() throws Exception {
        // Given
        doThrow(new NoRouteException("NO_ROUTE", "", "emails"))
                .when(producer).publish(any(), any(), any(), any(), anyBoolean(), anyBoolean(), any());

        // Then
        assertThrows(NoRouteException.class, () -> messagePublisher.publish("emails", testMessage, null));
        verify(producer).close();
    }
}
