package com.example.taskbroker.constant;

/**
 * Broker 相关常量定义
 *
 * 统一管理 AMQP 响应码、队列参数、队列名后缀等常量
 */
public class BrokerConstants {

    /** 默认队列名称 */
    public static final String DEFAULT_QUEUE_NAME = "default";

    /**
     * AMQP 0-9-1 响应码
     */
    public static class ReplyCode {
        /** 消息无法路由（mandatory 发布被退回） */
        public static final int NO_ROUTE = 312;

        /** 资源不存在（例如队列不存在） */
        public static final int NOT_FOUND = 404;

        /** 资源被锁定（例如其他连接的独占队列） */
        public static final int RESOURCE_LOCKED = 405;

        /** 前置条件失败（例如队列参数不一致） */
        public static final int PRECONDITION_FAILED = 406;

        /** 操作不允许 */
        public static final int NOT_ALLOWED = 530;

        /** 可恢复的 Channel 错误：内容过大、无消费者、资源不足 */
        public static final int CONTENT_TOO_LARGE = 311;
        public static final int NO_CONSUMERS = 313;
        public static final int RESOURCE_ERROR = 506;
    }

    /**
     * 队列声明参数（x-arguments）
     */
    public static class QueueArgument {
        public static final String MESSAGE_TTL = "x-message-ttl";
        public static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
        public static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
        public static final String MAX_PRIORITY = "x-max-priority";
    }

    /**
     * 物理队列名后缀
     */
    public static class QueueSuffix {
        /** 延迟队列 */
        public static final String DELAYED = ".DQ";

        /** 死信队列 */
        public static final String DEAD_LETTER = ".XQ";
    }

    /**
     * 消息 options 中的键
     */
    public static class MessageOption {
        public static final String ETA = "eta";
        public static final String BROKER_PRIORITY = "broker_priority";
    }

    /**
     * 默认配置
     */
    public static class DefaultConfig {
        /** 心跳间隔（秒），用于发现失效连接 */
        public static final int HEARTBEAT_SECONDS = 60;

        /** 持久化投递模式 */
        public static final int PERSISTENT_DELIVERY_MODE = 2;

        /** x-message-ttl 的最大值（毫秒），2^32-1 */
        public static final long MAX_MESSAGE_TTL_MILLIS = 4_294_967_295L;
    }
}
