package com.example.taskbroker.broker;

import com.example.taskbroker.model.ActorDescriptor;
import com.example.taskbroker.model.TaskMessage;

/**
 * Broker 生命周期事件监听器，所有方法默认为空实现
 */
public interface BrokerListener {

    default void beforeDeclareActor(ActorDescriptor actor) {
    }

    default void afterDeclareActor(ActorDescriptor actor) {
    }

    /**
     * 队列第一次被声明（UNKNOWN → PENDING）之前
     */
    default void beforeDeclareQueue(String queueName) {
    }

    default void afterDeclareQueue(String queueName) {
    }

    default void afterDeclareDelayQueue(String delayQueueName) {
    }

    /**
     * @param delay 延迟毫秒数，为空表示立即投递
     */
    default void beforeEnqueue(TaskMessage message, Long delay) {
    }

    default void afterEnqueue(TaskMessage message, Long delay) {
    }
}
