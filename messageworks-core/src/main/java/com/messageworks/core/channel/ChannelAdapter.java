package com.messageworks.core.channel;

import com.messageworks.core.message.Message;

/**
 * 通往相邻执行上下文的双向通道。
 * <p>
 * 路由器只通过这个接口收发消息，不关心底层传输（进程内队列、TCP 连接等）。
 * 消息顺序和送达保证由具体实现负责；接收方拿到的消息必须是独立副本。
 */
public interface ChannelAdapter {

    /**
     * 通道名称，用于日志。
     */
    String getName();

    /**
     * 发送一条消息给对端。
     *
     * @throws IllegalStateException 通道已关闭
     */
    void send(Message message);

    void subscribe(MessageListener listener);

    void unsubscribe(MessageListener listener);

    /**
     * 关闭通道，之后不再投递任何消息。
     */
    default void close() {
    }
}
