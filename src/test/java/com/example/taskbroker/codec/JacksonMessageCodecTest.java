package com.example.taskbroker.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.example.taskbroker.exception.MessageDecodeException;
import com.example.taskbroker.model.TaskMessage;

/**
 * JacksonMessageCodec 单元测试
 */
class JacksonMessageCodecTest {

    private final JacksonMessageCodec codec = new JacksonMessageCodec();

    @Test
    void testDecode_PreservesDelayedCopy() {
        // Given
        TaskMessage original = new TaskMessage("emails", "send_email", List.of("a@example.com", 3), Map.of("retries", 2));
        TaskMessage delayed = original.copy("emails.DQ", Map.of("eta", 1_700_000_000_000L));

        // When
        TaskMessage decoded = codec.decode(codec.encode(delayed));

        // Then
        assertEquals("emails.DQ", decoded.getQueueName());
        assertEquals("send_email", decoded.getActorName());
        assertEquals(original.getMessageId(), decoded.getMessageId());
        assertEquals(1_700_000_000_000L, ((Number) decoded.getOption("eta")).longValue());
        assertEquals(2, decoded.getKwargs().get("retries"));
    }

    @Test
    void testDecode_IgnoresUnknownFields() {
        // Given
        byte[] body = "{\"queueName\":\"emails\",\"actorName\":\"send_email\",\"extra\":true}"
                .getBytes(StandardCharsets.UTF_8);

        // When
        TaskMessage decoded = codec.decode(body);

        // Then
        assertEquals("emails", decoded.getQueueName());
    }

    @Test
    void testDecode_MalformedBody() {
        byte[] body = "not json".getBytes(StandardCharsets.UTF_8);

        assertThrows(MessageDecodeException.class, () -> codec.decode(body));
    }

    @Test
    void testDecode_MissingQueueName() {
        byte[] body = "{\"actorName\":\"send_email\"}".getBytes(StandardCharsets.UTF_8);

        assertThrows(MessageDecodeException.class, () -> codec.decode(body));
    }

    @Test
    void testGetContentType() {
        assertEquals("application/json", codec.getContentType());
    }
}
