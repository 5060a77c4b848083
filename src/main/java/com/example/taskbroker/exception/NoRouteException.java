package com.example.taskbroker.exception;

import com.example.taskbroker.constant.BrokerConstants.ReplyCode;

import lombok.Getter;

/**
 * mandatory 消息无法路由到任何队列（312 NO_ROUTE）
 */
@Getter
public class NoRouteException extends BrokerChannelException {

    private final String exchange;
    private final String routingKey;

    public NoRouteException(String replyText, String exchange, String routingKey) {
        super(String.format("消息无法路由: exchange='%s', routingKey='%s', 原因: %s",
                exchange, routingKey, replyText), ReplyCode.NO_ROUTE);
        this.exchange = exchange;
        this.routingKey = routingKey;
    }
}
