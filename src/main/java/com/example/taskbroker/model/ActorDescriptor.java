package com.example.taskbroker.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Actor 描述：名称及其消费的逻辑队列
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ActorDescriptor {

    private String actorName;
    private String queueName;
}
