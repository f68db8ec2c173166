package com.messageworks.server.handler;

import com.messageworks.core.message.Message;
import com.messageworks.server.connection.NettyChannelAdapter;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 客户端（上游连接）入站 handler：把解码后的消息交给对应的 NettyChannelAdapter。
 */
@Slf4j
public class ChannelAdapterInboundHandler extends SimpleChannelInboundHandler<Message> {

    @Getter
    private final NettyChannelAdapter adapter;

    public ChannelAdapterInboundHandler(NettyChannelAdapter adapter) {
        this.adapter = adapter;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Message msg) {
        adapter.onInbound(msg);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        log.info("ChannelAdapterInboundHandler: 上游连接 {} 已断开", adapter.getName());
        adapter.close();
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("ChannelAdapterInboundHandler: 连接 {} 发生异常", adapter.getName(), cause);
        ctx.close();
    }
}
