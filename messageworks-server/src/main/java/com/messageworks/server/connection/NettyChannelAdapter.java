package com.messageworks.server.connection;

import com.messageworks.core.channel.AbstractChannelAdapter;
import com.messageworks.core.message.Message;
import com.messageworks.core.message.MessageCodec;
import com.messageworks.core.message.MessageUtils;
import com.messageworks.core.runloop.Runloop;
import io.netty.channel.Channel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 基于 Netty Channel 的通道适配器。
 * 出站消息直接写入 Netty Channel；入站消息由 pipeline 末端的 handler 调用 {@link #onInbound(Message)} 投递。
 */
@Slf4j
public class NettyChannelAdapter extends AbstractChannelAdapter {

    @Getter
    private final Channel channel;

    public NettyChannelAdapter(String name, Channel channel, Runloop runloop) {
        super(name, runloop);
        this.channel = channel;
    }

    @Override
    public void send(Message message) {
        if (closed || !channel.isActive()) {
            throw new IllegalStateException("Channel " + name + " is not active");
        }
        // 编码在 IO 线程上异步进行，写出发送时刻的副本
        Message snapshot = MessageCodec.copy(message);
        channel.writeAndFlush(snapshot).addListener(future -> {
            if (!future.isSuccess()) {
                log.error("NettyChannelAdapter {}: 发送 {} 失败", name, MessageUtils.toDebugString(message),
                        future.cause());
            }
        });
    }

    public void onInbound(Message message) {
        deliver(message);
    }

    public boolean isActive() {
        return !closed && channel.isActive();
    }

    @Override
    protected void doClose() {
        if (channel.isOpen()) {
            channel.close();
        }
    }

    @Override
    public String toString() {
        return "NettyChannelAdapter[" + name + ", " + channel.remoteAddress() + "]";
    }
}
