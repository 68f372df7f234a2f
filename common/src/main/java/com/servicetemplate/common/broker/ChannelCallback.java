package com.servicetemplate.common.broker;

import java.io.IOException;

import com.rabbitmq.client.Channel;

/**
 * Work performed on the shared channel while the connection lock is held.
 */
@FunctionalInterface
public interface ChannelCallback<T> {

    T doInChannel(Channel channel) throws IOException, InterruptedException;
}
