package com.messageworks.server.handler;

import java.util.List;
import java.util.concurrent.ConcurrentMap;

import com.messageworks.core.message.Message;
import com.messageworks.core.message.MessageUtils;
import com.messageworks.core.runloop.Runloop;
import com.messageworks.core.service.MessagingService;
import com.messageworks.core.util.AddressUtils;
import com.messageworks.server.connection.NettyChannelAdapter;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import lombok.extern.slf4j.Slf4j;

/**
 * 服务端入站 handler，每个连接一个实例。
 * <p>
 * 连接上的第一条消息必须是接入握手消息（data 为子上下文名称），收到后把连接注册为 MessagingService 的子上下文；
 * 之后的消息交给该子上下文的 NettyChannelAdapter。连接断开时注销子上下文。
 */
@Slf4j
public class MessageInboundHandler extends SimpleChannelInboundHandler<Message> {

    private final MessagingService service;
    private final Runloop runloop;
    private final ConcurrentMap<String, NettyChannelAdapter> attachedChildren;

    private NettyChannelAdapter adapter;
    private String childName;

    public MessageInboundHandler(MessagingService service, Runloop runloop,
            ConcurrentMap<String, NettyChannelAdapter> attachedChildren) {
        this.service = service;
        this.runloop = runloop;
        this.attachedChildren = attachedChildren;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, Message msg) {
        if (adapter != null) {
            adapter.onInbound(msg);
            return;
        }
        if (!MessageUtils.isAttachMessage(msg)) {
            log.warn("MessageInboundHandler: 连接 {} 尚未接入，丢弃消息 {}", ctx.channel().id().asShortText(),
                    MessageUtils.toDebugString(msg));
            return;
        }
        String name = msg.getData(String.class);
        List<String> segments = name == null ? List.of() : AddressUtils.toSegments(name);
        if (segments.size() != 1) {
            log.warn("MessageInboundHandler: 连接 {} 的接入名称 '{}' 不是单个地址分段，关闭连接",
                    ctx.channel().id().asShortText(), name);
            ctx.close();
            return;
        }
        childName = segments.get(0);
        adapter = new NettyChannelAdapter("tcp:" + childName, ctx.channel(), runloop);
        NettyChannelAdapter previous = attachedChildren.put(childName, adapter);
        if (previous != null) {
            log.info("MessageInboundHandler: 子上下文 {} 重新接入，关闭旧连接", childName);
            previous.close();
        }
        service.addChild(childName, adapter);
        log.info("MessageInboundHandler: 子上下文 {} 已通过连接 {} 接入", childName, ctx.channel().remoteAddress());
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (adapter != null) {
            if (attachedChildren.remove(childName, adapter)) {
                service.removeChild(childName);
                log.info("MessageInboundHandler: 子上下文 {} 已断开并注销", childName);
            }
            adapter.close();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.error("MessageInboundHandler: 连接 {} 发生异常", ctx.channel().id().asShortText(), cause);
        ctx.close();
    }
}
