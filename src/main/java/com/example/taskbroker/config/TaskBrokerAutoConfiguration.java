package com.example.taskbroker.config;

import java.security.GeneralSecurityException;
import java.time.Duration;

import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.example.taskbroker.broker.BrokerListener;
import com.example.taskbroker.broker.RabbitTaskBroker;
import com.example.taskbroker.codec.JacksonMessageCodec;
import com.example.taskbroker.codec.MessageCodec;
import com.example.taskbroker.connection.ConnectionHolder;
import com.example.taskbroker.connection.PooledConnectionHolder;
import com.example.taskbroker.connection.SharedConnectionHolder;
import com.example.taskbroker.constant.BrokerConstants.DefaultConfig;
import com.example.taskbroker.exception.ConfigurationException;
import com.example.taskbroker.topology.DefaultQueueTopology;
import com.example.taskbroker.topology.DlxRoutingTopology;
import com.example.taskbroker.topology.QueueTopology;
import com.example.taskbroker.topology.TopologyConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.ConnectionFactory;

import lombok.extern.slf4j.Slf4j;

/**
 * 任务 Broker 自动配置
 *
 * 所有 Bean 都可以被应用自己定义的同类型 Bean 替换
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(CachingConnectionFactory.class)
@EnableConfigurationProperties({TaskBrokerProperties.class, RabbitProperties.class})
public class TaskBrokerAutoConfiguration {

    /**
     * 底层 RabbitMQ 连接工厂，由 Holder 包装成连接池
     */
    @Bean
    @ConditionalOnMissingBean
    public ConnectionFactory taskBrokerRabbitConnectionFactory(RabbitProperties properties) {
        ConnectionFactory factory = new ConnectionFactory();

        // 基本连接配置
        factory.setHost(properties.determineHost());
        factory.setPort(properties.determinePort());
        factory.setUsername(properties.determineUsername());
        factory.setPassword(properties.determinePassword());
        if (properties.determineVirtualHost() != null) {
            factory.setVirtualHost(properties.determineVirtualHost());
        }

        // 心跳用于发现失效连接
        Duration heartbeat = properties.getRequestedHeartbeat();
        factory.setRequestedHeartbeat(heartbeat != null ? (int) heartbeat.getSeconds() : DefaultConfig.HEARTBEAT_SECONDS);

        // 连接超时配置
        Duration connectionTimeout = properties.getConnectionTimeout();
        factory.setConnectionTimeout(connectionTimeout != null ? (int) connectionTimeout.toMillis() : 15000);
        factory.setHandshakeTimeout(10000);

        // 重连由 ConnectionHolder 的重试策略负责
        factory.setAutomaticRecoveryEnabled(false);

        if (Boolean.TRUE.equals(properties.getSsl().getEnabled())) {
            try {
                factory.useSslProtocol();
            } catch (GeneralSecurityException e) {
                throw new ConfigurationException("初始化 SSL 失败: " + e.getMessage());
            }
        }
        return factory;
    }

    @Bean
    @ConditionalOnMissingBean
    public QueueTopology taskBrokerTopology(TaskBrokerProperties properties) {
        TopologyConfig config = properties.getTopology();
        if (config.getRouting() == TopologyConfig.Routing.DLX) {
            return new DlxRoutingTopology(config);
        }
        return new DefaultQueueTopology(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageCodec taskBrokerMessageCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new JacksonMessageCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionHolder taskBrokerConnectionHolder(ConnectionFactory taskBrokerRabbitConnectionFactory,
                                                       TaskBrokerProperties properties) {
        if (properties.getStrategy() == null) {
            throw new ConfigurationException("task-broker.strategy 不能为空");
        }
        log.info("[TaskBroker] 连接策略: {}", properties.getStrategy());
        switch (properties.getStrategy()) {
            case SHARED:
                return new SharedConnectionHolder(taskBrokerRabbitConnectionFactory, properties.getPool());
            case POOLED:
                return new PooledConnectionHolder(taskBrokerRabbitConnectionFactory, properties.getPool());
            default:
                throw new ConfigurationException("未知的连接策略: " + properties.getStrategy());
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public RabbitTaskBroker taskBroker(ConnectionHolder connectionHolder, QueueTopology topology,
                                       MessageCodec codec, TaskBrokerProperties properties,
                                       ObjectProvider<BrokerListener> listeners) {
        RabbitTaskBroker broker = new RabbitTaskBroker(connectionHolder, topology, codec, properties.toBrokerOptions());
        listeners.orderedStream().forEach(broker::addListener);
        return broker;
    }
}
