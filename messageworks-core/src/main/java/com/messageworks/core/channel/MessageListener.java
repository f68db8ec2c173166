package com.messageworks.core.channel;

import com.messageworks.core.message.Message;

/**
 * 入站消息回调。
 */
@FunctionalInterface
public interface MessageListener {

    void onMessage(Message message);
}
