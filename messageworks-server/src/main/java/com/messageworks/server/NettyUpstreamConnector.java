package com.messageworks.server;

import java.util.concurrent.CompletableFuture;

import com.messageworks.core.config.TransportConfig;
import com.messageworks.core.message.MessageUtils;
import com.messageworks.core.runloop.Runloop;
import com.messageworks.server.connection.NettyChannelAdapter;
import com.messageworks.server.handler.ChannelAdapterInboundHandler;
import com.messageworks.server.message.MessagePipeline;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import lombok.extern.slf4j.Slf4j;

/**
 * 将本进程的子上下文接入远端父上下文的 {@link NettyMessageServer}。
 * 连接建立后先发送接入握手消息，返回的 NettyChannelAdapter 可直接作为 ChildEnvironment 的上游通道。
 */
@Slf4j
public class NettyUpstreamConnector {

    private final TransportConfig config;
    private final Runloop runloop;
    private final EventLoopGroup group = new NioEventLoopGroup(1);

    /**
     * @param runloop 子上下文的 Runloop，上游入站消息在其上处理（可为 null）
     */
    public NettyUpstreamConnector(TransportConfig config, Runloop runloop) {
        this.config = config;
        this.runloop = runloop;
    }

    public CompletableFuture<NettyChannelAdapter> connect(String childName) {
        return connect(config.getHost(), config.getPort(), childName);
    }

    public CompletableFuture<NettyChannelAdapter> connect(String host, int port, String childName) {
        CompletableFuture<NettyChannelAdapter> result = new CompletableFuture<>();
        if (childName == null || childName.isBlank()) {
            result.completeExceptionally(new IllegalArgumentException("child name must not be blank"));
            return result;
        }
        Bootstrap b = new Bootstrap();
        b.group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, config.getConnectTimeoutMs())
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        NettyChannelAdapter adapter = new NettyChannelAdapter("tcp:upstream:" + childName, ch,
                                runloop);
                        MessagePipeline.addCodec(ch.pipeline(), config);
                        ch.pipeline().addLast("upstreamInboundHandler", new ChannelAdapterInboundHandler(adapter));
                    }
                });

        ChannelFuture connectFuture = b.connect(host, port);
        connectFuture.addListener(future -> {
            if (!future.isSuccess()) {
                log.error("NettyUpstreamConnector: 连接 {}:{} 失败", host, port, future.cause());
                result.completeExceptionally(future.cause());
                return;
            }
            Channel channel = connectFuture.channel();
            NettyChannelAdapter adapter = channel.pipeline().get(ChannelAdapterInboundHandler.class).getAdapter();
            channel.writeAndFlush(MessageUtils.attachMessage(childName)).addListener(attach -> {
                if (attach.isSuccess()) {
                    log.info("NettyUpstreamConnector: 子上下文 {} 已接入 {}:{}", childName, host, port);
                    result.complete(adapter);
                } else {
                    log.error("NettyUpstreamConnector: 发送接入消息失败", attach.cause());
                    channel.close();
                    result.completeExceptionally(attach.cause());
                }
            });
        });
        return result;
    }

    public CompletableFuture<Void> shutdown() {
        CompletableFuture<Void> result = new CompletableFuture<>();
        group.shutdownGracefully().addListener(f -> {
            if (f.isSuccess()) {
                log.info("NettyUpstreamConnector shut down.");
                result.complete(null);
            } else {
                result.completeExceptionally(f.cause());
            }
        });
        return result;
    }
}
