package com.example.taskbroker.codec;

import com.example.taskbroker.exception.MessageDecodeException;
import com.example.taskbroker.model.TaskMessage;

/**
 * 消息编解码器，Broker 将消息体视为不透明字节
 */
public interface MessageCodec {

    byte[] encode(TaskMessage message);

    TaskMessage decode(byte[] body) throws MessageDecodeException;

    /**
     * 发布时写入 content-type 属性
     */
    String getContentType();
}
