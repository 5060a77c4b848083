package com.example.taskbroker.codec;

import java.io.IOException;

import com.example.taskbroker.exception.MessageDecodeException;
import com.example.taskbroker.exception.TaskBrokerException;
import com.example.taskbroker.model.TaskMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON 编解码器（默认实现）
 * 注册 JavaTimeModule 以支持参数中的 Java 8 日期时间类型
 */
public class JacksonMessageCodec implements MessageCodec {

    private final ObjectMapper objectMapper;

    public JacksonMessageCodec() {
        this(new ObjectMapper());
    }

    public JacksonMessageCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Override
    public byte[] encode(TaskMessage message) {
        try {
            return objectMapper.writeValueAsBytes(message);
        } catch (JsonProcessingException e) {
            throw new TaskBrokerException("消息编码失败: " + message.getMessageId(), e);
        }
    }

    @Override
    public TaskMessage decode(byte[] body) {
        try {
            TaskMessage message = objectMapper.readValue(body, TaskMessage.class);
            if (message == null || message.getQueueName() == null) {
                throw new MessageDecodeException("消息缺少 queueName 字段", null);
            }
            return message;
        } catch (IOException e) {
            throw new MessageDecodeException("消息解码失败: " + e.getMessage(), e);
        }
    }

    @Override
    public String getContentType() {
        return "application/json";
    }
}
