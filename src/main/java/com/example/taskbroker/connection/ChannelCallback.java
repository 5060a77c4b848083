package com.example.taskbroker.connection;

import java.io.IOException;

/**
 * 在借出的 Channel 上执行的操作
 */
@FunctionalInterface
public interface ChannelCallback<T> {

    T doInChannel(BrokerChannel channel) throws IOException;
}
