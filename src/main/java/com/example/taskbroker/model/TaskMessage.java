package com.example.taskbroker.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 任务消息实体类
 *
 * 生命周期：创建 → （可选）改写为延迟消息 → 发布 → 投递 → 包装为 MessageProxy → ack/nack
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TaskMessage implements Serializable {

    private String queueName;
    private String actorName;
    private List<Object> args = new ArrayList<>();
    private Map<String, Object> kwargs = new LinkedHashMap<>();
    private Map<String, Object> options = new LinkedHashMap<>();
    private String messageId;
    private long messageTimestamp;

    public TaskMessage(String queueName, String actorName, List<Object> args, Map<String, Object> kwargs) {
        this.queueName = queueName;
        this.actorName = actorName;
        this.args = new ArrayList<>(args);
        this.kwargs = new LinkedHashMap<>(kwargs);
        this.messageId = UUID.randomUUID().toString();
        this.messageTimestamp = System.currentTimeMillis();
    }

    /**
     * 复制消息，替换队列名并合并 options；原消息不变
     */
    public TaskMessage copy(String newQueueName, Map<String, Object> extraOptions) {
        Map<String, Object> mergedOptions = new LinkedHashMap<>(options);
        mergedOptions.putAll(extraOptions);
        return new TaskMessage(newQueueName, actorName, new ArrayList<>(args),
                new LinkedHashMap<>(kwargs), mergedOptions, messageId, messageTimestamp);
    }

    public Object getOption(String key) {
        return options.get(key);
    }
}
